package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.parent.ParentSelector;
import cz.iocb.chemname.parent.ParentStructure;



/**
 * Selects the parent structure. Principal groups that are not attached to it are demoted to prefixes.
 */
public final class ParentSelectionRule extends Rule
{
    public ParentSelectionRule()
    {
        super("parent-selection", "selection of the parent structure", "P-44", Phase.PARENT_SELECTION);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return context.getParent() == null;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        ParentSelector selector = new ParentSelector(context.getMolecule(), context.getTables());
        ParentStructure parent = selector.select(context.getGroups(), context.getRingSystems(), context.getBlocked());

        if(parent == null)
        {
            String message = "no ring or carbon chain to serve as the parent";
            return context.withStateUpdate().trace(trace(message))
                    .error(warning(NamingWarning.Type.NO_PARENT, message)).build();
        }

        NamingContext.Builder builder = context.withStateUpdate().parent(parent);
        builder.trace(trace(parent.getKind() + " parent of " + parent.getSize() + " atoms", parent.getAtomSet()));

        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();
        List<FunctionalGroup> esters = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : context.getGroups())
        {
            if(group.isPrincipal() && ParentSelector.anchorOf(context.getMolecule(), group, parent) < 0)
            {
                groups.add(group.withPrincipal(false));
                builder.trace(trace(group.getType() + " outside the parent cited as a prefix",
                        FunctionalGroupRule.atoms(group)));
            }
            else
            {
                groups.add(group);

                if(context.getEsters().contains(group))
                    esters.add(group);
            }
        }

        return builder.groups(groups).esters(esters).build();
    }
}
