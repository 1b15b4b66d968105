package cz.iocb.chemname.engine;

import cz.iocb.chemname.group.FunctionalGroup;



/**
 * Records ring carbonyl groups of lactams and lactones, which are named as heterocyclic ketones.
 */
public final class LactamRule extends Rule
{
    public LactamRule()
    {
        super("lactams", "lactams and lactones", "P-66.1.4.1", Phase.FUNCTIONAL_GROUP_DETECTION);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        for(FunctionalGroup group : context.getGroups())
            if(group.isAbsorbed())
                return true;

        return false;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        NamingContext.Builder builder = context.withStateUpdate();

        for(FunctionalGroup group : context.getGroups())
            if(group.isAbsorbed())
                builder.trace(trace(group.getPattern() + " carbonyl expressed as a ring ketone",
                        FunctionalGroupRule.atoms(group)));

        return builder.build();
    }
}
