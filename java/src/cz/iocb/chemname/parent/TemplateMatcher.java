package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.rules.RingTemplate;



/**
 * Maps retained ring templates onto ring systems of a molecule. Atoms must agree in element and aromaticity; bonds
 * must agree in aromaticity and, when not aromatic, in order. Hydrogen counts are ignored, so indicated hydrogen may
 * sit on any equivalent atom.
 */
public class TemplateMatcher
{
    private final RingTemplate template;
    private final Molecule target;
    private final RingSystem system;

    private final Molecule query;
    private final int[] mapping;
    private final boolean[] used;
    private final List<int[]> mappings = new ArrayList<int[]>();


    private TemplateMatcher(RingTemplate template, Molecule target, RingSystem system)
    {
        this.template = template;
        this.target = target;
        this.system = system;
        this.query = template.getMolecule();
        this.mapping = new int[query.getAtomCount()];
        this.used = new boolean[target.getAtomCount()];
    }


    /**
     * @return every mapping of template atoms onto atoms of the ring system
     */
    public static List<int[]> match(RingTemplate template, Molecule target, RingSystem system)
    {
        Molecule query = template.getMolecule();

        if(query.getAtomCount() != system.getAtomCount() || query.getBondCount() != system.getBonds().length)
            return new ArrayList<int[]>();

        TemplateMatcher matcher = new TemplateMatcher(template, target, system);
        matcher.extend(0);
        return matcher.mappings;
    }


    /**
     * @return numberings induced by all template mappings
     */
    public static List<Numbering> numberings(RingTemplate template, Molecule target, RingSystem system)
    {
        List<Numbering> numberings = new ArrayList<Numbering>();

        for(int[] mapping : match(template, target, system))
        {
            Locant[] locants = new Locant[mapping.length];

            for(int i = 0; i < mapping.length; i++)
                locants[i] = template.getLocant(i);

            numberings.add(new Numbering(mapping, locants));
        }

        return numberings;
    }


    private void extend(int queryAtom)
    {
        if(queryAtom == mapping.length)
        {
            mappings.add(mapping.clone());
            return;
        }

        for(int candidate : system.getAtoms())
        {
            if(used[candidate] || !atomsMatch(queryAtom, candidate) || !bondsMatch(queryAtom, candidate))
                continue;

            mapping[queryAtom] = candidate;
            used[candidate] = true;

            extend(queryAtom + 1);

            used[candidate] = false;
        }
    }


    private boolean atomsMatch(int queryAtom, int targetAtom)
    {
        return query.getAtomicNumber(queryAtom) == target.getAtomicNumber(targetAtom)
                && query.getAtom(queryAtom).isAromatic() == target.getAtom(targetAtom).isAromatic();
    }


    /**
     * Checks the bonds from the query atom to all previously mapped query atoms.
     */
    private boolean bondsMatch(int queryAtom, int targetAtom)
    {
        for(int previous = 0; previous < queryAtom; previous++)
        {
            Bond queryBond = query.getBond(queryAtom, previous);
            Bond targetBond = target.getBond(targetAtom, mapping[previous]);

            if(targetBond != null && !system.containsBond(targetBond.getId()))
                targetBond = null;

            if((queryBond == null) != (targetBond == null))
                return false;

            if(queryBond == null)
                continue;

            if(queryBond.isAromatic() != targetBond.isAromatic())
                return false;

            if(!queryBond.isAromatic() && queryBond.getOrder() != targetBond.getOrder())
                return false;
        }

        return true;
    }


    @Override
    public String toString()
    {
        return "TemplateMatcher[" + template + "]";
    }
}
