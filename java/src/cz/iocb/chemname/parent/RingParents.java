package cz.iocb.chemname.parent;

import java.util.List;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.rules.NomenclatureTables;
import cz.iocb.chemname.rules.RingTemplate;



/**
 * Creates the parent structure describing a ring system: a monocycle, a retained fused system, a von Baeyer system or
 * a monospiro system.
 */
public class RingParents
{
    public static final int MAX_HANTZSCH_WIDMAN_SIZE = 10;


    public static ParentStructure create(Molecule molecule, RingSystem system, NomenclatureTables tables)
    {
        switch(system.getType())
        {
            case MONOCYCLE:
                int[] ring = system.getRings().get(0);
                RingTemplate template = findTemplate(molecule, system, tables);
                boolean aromatic = system.isAromatic(molecule);

                /* aromatic rings without a retained name keep a mancude name only as Hantzsch-Widman heterocycles */
                boolean mancude = aromatic && (template != null
                        || system.getHeteroatomCount(molecule) > 0 && ring.length <= MAX_HANTZSCH_WIDMAN_SIZE);

                return new SimpleRing(ring, template, mancude);

            case POLYCYCLE:
                if(system.isAromatic(molecule))
                {
                    for(RingTemplate fused : tables.getRingTemplates())
                    {
                        List<Numbering> numberings = TemplateMatcher.numberings(fused, molecule, system);

                        if(!numberings.isEmpty())
                            return new FusedRingSystem(system, fused, numberings);
                    }
                }

                return VonBaeyerAnalyzer.analyze(molecule, system);

            case SPIRO:
                return new SpiroRingSystem(system);

            default:
                throw new IllegalArgumentException("unknown ring system type " + system.getType());
        }
    }


    private static RingTemplate findTemplate(Molecule molecule, RingSystem system, NomenclatureTables tables)
    {
        for(RingTemplate template : tables.getRingTemplates())
            if(template.getSize() == system.getAtomCount() && !TemplateMatcher.match(template, molecule, system).isEmpty())
                return template;

        return null;
    }
}
