package cz.iocb.chemname.engine;

import cz.iocb.chemname.parent.ParentNamer;
import cz.iocb.chemname.parent.ParentStructure;



/**
 * Names the bare parent hydride when no complete name could be assembled.
 */
public final class FallbackRule extends Rule
{
    static final double FALLBACK_PENALTY = 0.3;


    public FallbackRule()
    {
        super("fallback", "parent hydride fallback", "P-2", Phase.NAME_ASSEMBLY);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return context.getName() == null && context.getParent() != null;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        ParentStructure parent = context.getParent();

        if(parent.getNumbering() == null)
            parent = parent.withNumbering(parent.getCandidateNumberings().get(0));

        String name = new ParentNamer(context.getMolecule(), context.getTables()).name(parent, null, 0);

        return context.withStateUpdate().name(name, NamingContext.Method.FALLBACK).confidence(FALLBACK_PENALTY)
                .trace(trace("named as the bare parent " + name)).build();
    }
}
