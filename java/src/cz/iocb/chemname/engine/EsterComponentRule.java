package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.Branch;
import cz.iocb.chemname.substituent.Substituent;



/**
 * Names the alkyl components of functional class esters as substituent groups.
 */
public final class EsterComponentRule extends Rule
{
    public EsterComponentRule()
    {
        super("ester-components", "alkyl components of esters", "P-65.6.3.2.1", Phase.SUBSTITUENT_ASSEMBLY);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return !context.getEsters().isEmpty() && context.getParent() != null;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        Molecule molecule = context.getMolecule();
        List<Substituent> components = new ArrayList<Substituent>();
        NamingContext.Builder builder = context.withStateUpdate();
        boolean unrecognized = false;

        for(FunctionalGroup ester : context.getEsters())
        {
            int oxygen = EsterRule.esterOxygen(molecule, ester);
            int root = EsterRule.alkylRoot(molecule, ester);
            Set<Integer> excluded = new HashSet<Integer>(FunctionalGroupRule.atoms(ester));

            Substituent component = context.getAssembler().name(new Branch(oxygen, root, 1), excluded);
            components.add(component);
            unrecognized |= !component.isRecognized();

            builder.trace(trace("alkyl component " + component.getName(), FunctionalGroupRule.atoms(ester)));
        }

        if(unrecognized)
            builder.warning(warning(NamingWarning.Type.UNRECOGNIZED_FRAGMENT,
                    "an ester component without a known name is cited as \"unknown\""));

        return builder.esterComponents(components).build();
    }
}
