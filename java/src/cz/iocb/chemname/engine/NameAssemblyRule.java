package cz.iocb.chemname.engine;

import cz.iocb.chemname.assembly.NameAssembler;



/**
 * Assembles the final name from the prefixes, the parent and its suffix.
 */
public final class NameAssemblyRule extends Rule
{
    /** confidence factor of names using constructions without an established rule */
    static final double APPROXIMATION_PENALTY = 0.8;


    public NameAssemblyRule()
    {
        super("name-assembly", "name construction", "P-14.5", Phase.NAME_ASSEMBLY);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return context.getName() == null && context.getParent() != null
                && context.getParent().getNumbering() != null;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        NameAssembler assembler = new NameAssembler(context.getMolecule(), context.getTables());
        NameAssembler.AssembledName name = assembler.assemble(context.getParent(), context.getPrincipalGroups(),
                context.getSubstituents(), context.getEsterComponents());

        NamingContext.Method method = NamingContext.Method.SYSTEMATIC;

        if(name.isFunctionalClass())
            method = NamingContext.Method.FUNCTIONAL_CLASS;
        else if(name.isRetained())
            method = NamingContext.Method.RETAINED;

        NamingContext.Builder builder = context.withStateUpdate().name(name.getName(), method);
        builder.trace(trace(method + " name " + name.getName()));

        if(name.isApproximate())
        {
            builder.confidence(APPROXIMATION_PENALTY);
            builder.trace(trace("parent named by an approximate construction"));
        }

        return builder.build();
    }
}
