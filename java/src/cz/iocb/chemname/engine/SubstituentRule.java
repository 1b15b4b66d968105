package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.parent.Branch;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.substituent.Substituent;
import cz.iocb.chemname.substituent.SubstituentAssembler;



/**
 * Names the substituents of the numbered parent, including the substituents on the nitrogen atoms of principal
 * amines, amides and imines, which are located by "N", "N'", ...
 */
public final class SubstituentRule extends Rule
{
    public SubstituentRule()
    {
        super("substituents", "substituent prefixes", "P-29", Phase.SUBSTITUENT_ASSEMBLY);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return context.getParent() != null && context.getParent().getNumbering() != null;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        Molecule molecule = context.getMolecule();
        ParentStructure parent = context.getParent();
        Numbering numbering = parent.getNumbering();
        SubstituentAssembler assembler = context.getAssembler();

        Set<Integer> excluded = context.getExcludedAtoms();
        Set<Integer> inner = new HashSet<Integer>(excluded);
        inner.addAll(parent.getAtomSet());

        List<Substituent> substituents = new ArrayList<Substituent>();

        for(Branch branch : Branch.find(molecule, parent.getAtomSet(), excluded))
            substituents.add(assembler.name(branch, inner).withLocant(numbering.getLocant(branch.getAttachment())));

        List<FunctionalGroup> nitrogenGroups = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : context.getPrincipalGroups())
            if(group.getNitrogen() >= 0 && !parent.contains(group.getNitrogen()))
                nitrogenGroups.add(group);

        Collections.sort(nitrogenGroups, new Comparator<FunctionalGroup>()
        {
            @Override
            public int compare(FunctionalGroup a, FunctionalGroup b)
            {
                return a.getLocants().get(0).compareTo(b.getLocants().get(0));
            }
        });

        for(int i = 0; i < nitrogenGroups.size(); i++)
        {
            FunctionalGroup group = nitrogenGroups.get(i);
            int nitrogen = group.getNitrogen();

            Set<Integer> nitrogenInner = new HashSet<Integer>(inner);
            nitrogenInner.addAll(FunctionalGroupRule.atoms(group));

            for(int j = 0; j < molecule.getDegree(nitrogen); j++)
            {
                int neighbour = molecule.getNeighbour(nitrogen, j);

                if(nitrogenInner.contains(neighbour))
                    continue;

                Branch branch = new Branch(nitrogen, neighbour, molecule.getNeighbourBond(nitrogen, j).getOrder());
                substituents.add(assembler.name(branch, nitrogenInner).withLocant(Locant.heteroatom("N", i)));
            }
        }

        NamingContext.Builder builder = context.withStateUpdate().substituents(substituents);
        boolean unrecognized = false;
        boolean approximate = false;

        for(Substituent substituent : substituents)
        {
            builder.trace(trace(substituent.toString(), Collections.singletonList(substituent.getAttachment())));
            unrecognized |= !substituent.isRecognized();
            approximate |= substituent.isApproximate();
        }

        if(unrecognized)
            builder.warning(warning(NamingWarning.Type.UNRECOGNIZED_FRAGMENT,
                    "a fragment without a known prefix is cited as \"unknown\""));

        if(approximate)
            builder.confidence(NameAssemblyRule.APPROXIMATION_PENALTY);

        return builder.build();
    }
}
