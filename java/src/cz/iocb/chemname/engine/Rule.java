package cz.iocb.chemname.engine;

import java.util.Collection;
import java.util.Collections;



/**
 * Single step of the naming pipeline. Rules are stateless and never modify the context they receive.
 */
public abstract class Rule
{
    private final String id;
    private final String name;
    private final String reference;
    private final Phase phase;


    protected Rule(String id, String name, String reference, Phase phase)
    {
        this.id = id;
        this.name = name;
        this.reference = reference;
        this.phase = phase;
    }


    public String getId()
    {
        return id;
    }


    public String getName()
    {
        return name;
    }


    public String getReference()
    {
        return reference;
    }


    public Phase getPhase()
    {
        return phase;
    }


    /**
     * @return whether the rule applies to the context
     */
    public abstract boolean matches(NamingContext context);


    /**
     * @return new context with the effect of the rule
     */
    public abstract NamingContext apply(NamingContext context);


    protected TraceEntry trace(String description, Collection<Integer> atoms)
    {
        return new TraceEntry(id, name, reference, phase, description, atoms);
    }


    protected TraceEntry trace(String description)
    {
        return trace(description, Collections.<Integer> emptyList());
    }


    protected NamingWarning warning(NamingWarning.Type type, String message)
    {
        return new NamingWarning(type, id, message);
    }


    @Override
    public String toString()
    {
        return id + " " + name;
    }
}
