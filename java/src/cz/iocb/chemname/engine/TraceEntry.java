package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;



/**
 * Record of one rule application.
 */
public final class TraceEntry
{
    private final String ruleId;
    private final String ruleName;
    private final String reference;
    private final Phase phase;
    private final String description;
    private final List<Integer> atoms;


    public TraceEntry(String ruleId, String ruleName, String reference, Phase phase, String description,
            Collection<Integer> atoms)
    {
        List<Integer> sorted = new ArrayList<Integer>(atoms);
        Collections.sort(sorted);

        this.ruleId = ruleId;
        this.ruleName = ruleName;
        this.reference = reference;
        this.phase = phase;
        this.description = description;
        this.atoms = Collections.unmodifiableList(sorted);
    }


    public String getRuleId()
    {
        return ruleId;
    }


    public String getRuleName()
    {
        return ruleName;
    }


    /**
     * @return section of the IUPAC recommendations (Blue Book) the rule implements
     */
    public String getReference()
    {
        return reference;
    }


    public Phase getPhase()
    {
        return phase;
    }


    public String getDescription()
    {
        return description;
    }


    public List<Integer> getAtoms()
    {
        return atoms;
    }


    @Override
    public String toString()
    {
        return phase + " " + ruleId + " (" + reference + ") " + ruleName + ": " + description
                + (atoms.isEmpty() ? "" : " " + atoms);
    }
}
