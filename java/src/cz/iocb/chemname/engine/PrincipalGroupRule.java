package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.group.GroupType;



/**
 * Flags the groups of the most senior class that can be cited as a suffix.
 */
public final class PrincipalGroupRule extends Rule
{
    public PrincipalGroupRule()
    {
        super("principal-group", "principal characteristic group", "P-41", Phase.FUNCTIONAL_GROUP_DETECTION);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        for(FunctionalGroup group : context.getGroups())
            if(group.getType().isSuffix())
                return true;

        return false;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        GroupType senior = null;
        Set<GroupType> outranked = new LinkedHashSet<GroupType>();

        for(FunctionalGroup group : context.getGroups())
            if(group.getType().isSuffix() && (senior == null || group.getPriority() < senior.getPriority()))
                senior = group.getType();

        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();
        List<Integer> atoms = new ArrayList<Integer>();

        for(FunctionalGroup group : context.getGroups())
        {
            boolean principal = group.getType() == senior;
            groups.add(group.withPrincipal(principal));

            if(principal)
                atoms.addAll(FunctionalGroupRule.atoms(group));
            else if(group.getType().isSuffix())
                outranked.add(group.getType());
        }

        NamingContext.Builder builder = context.withStateUpdate().groups(groups);
        builder.trace(trace("principal group " + senior, atoms));

        for(GroupType type : outranked)
            builder.trace(trace(NamingWarning.Type.SENIORITY_CONFLICT + ": " + type + " outranked by " + senior
                    + ", cited as a prefix"));

        return builder.build();
    }
}
