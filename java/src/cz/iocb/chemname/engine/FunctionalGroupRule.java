package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.group.FunctionalGroupDetector;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.RingSystem;
import cz.iocb.chemname.parent.RingSystemAnalyzer;
import cz.iocb.chemname.substituent.SubstituentAssembler;



/**
 * Detects characteristic groups and ring systems.
 */
public final class FunctionalGroupRule extends Rule
{
    private final FunctionalGroupDetector detector = new FunctionalGroupDetector();
    private final RingSystemAnalyzer analyzer = new RingSystemAnalyzer();


    public FunctionalGroupRule()
    {
        super("functional-groups", "characteristic group detection", "P-33", Phase.FUNCTIONAL_GROUP_DETECTION);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return context.getAssembler() == null;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        Molecule molecule = context.getMolecule();
        List<RingSystem> systems = analyzer.analyze(molecule);
        List<FunctionalGroup> groups = detector.detect(molecule);

        NamingContext.Builder builder = context.withStateUpdate().ringSystems(systems).groups(groups)
                .assembler(new SubstituentAssembler(molecule, context.getTables(), systems));

        for(FunctionalGroup group : groups)
            builder.trace(trace(group.getType() + " (" + group.getPattern() + ")", atoms(group)));

        if(groups.isEmpty())
            builder.trace(trace("no characteristic group, named as a parent hydride"));

        return builder.build();
    }


    static List<Integer> atoms(FunctionalGroup group)
    {
        List<Integer> atoms = new ArrayList<Integer>();

        for(int atom : group.getAtoms())
            atoms.add(atom);

        return atoms;
    }
}
