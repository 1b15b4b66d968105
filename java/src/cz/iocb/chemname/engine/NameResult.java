package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.parent.ParentStructure;



/**
 * Outcome of one naming invocation.
 */
public final class NameResult
{
    private final String name;
    private final double confidence;
    private final List<FunctionalGroup> groups;
    private final ParentStructure parent;
    private final Map<Integer, Locant> locants;
    private final NamingContext.Method method;
    private final List<TraceEntry> trace;
    private final List<NamingWarning> warnings;
    private final boolean error;


    NameResult(NamingContext context)
    {
        this.name = context.getName() == null ? "" : context.getName();
        this.confidence = context.getConfidence();
        this.groups = context.getGroups();
        this.parent = context.getParent();
        this.method = context.getMethod();
        this.trace = context.getTrace();
        this.warnings = context.getWarnings();
        this.error = context.isError();

        Map<Integer, Locant> map = new LinkedHashMap<Integer, Locant>();

        if(parent != null && parent.getNumbering() != null)
        {
            Numbering numbering = parent.getNumbering();

            for(int position = 0; position < numbering.size(); position++)
                map.put(numbering.getAtom(position), numbering.getLocantAt(position));
        }

        this.locants = Collections.unmodifiableMap(map);
    }


    public String getName()
    {
        return name;
    }


    /**
     * @return value between 0 and 1; 1 for names built by established rules only
     */
    public double getConfidence()
    {
        return confidence;
    }


    public List<FunctionalGroup> getFunctionalGroups()
    {
        return groups;
    }


    /**
     * @return selected parent structure, or null if no parent was found
     */
    public ParentStructure getParent()
    {
        return parent;
    }


    /**
     * @return locants of the parent atoms in numbering order
     */
    public Map<Integer, Locant> getLocants()
    {
        return locants;
    }


    /**
     * @return naming method, or null for failed invocations
     */
    public NamingContext.Method getMethod()
    {
        return method;
    }


    public List<TraceEntry> getTrace()
    {
        return trace;
    }


    /**
     * @return trace entries of the detected functional groups
     */
    public List<TraceEntry> getFunctionalGroupTrace()
    {
        List<TraceEntry> entries = new ArrayList<TraceEntry>();

        for(TraceEntry entry : trace)
            if(entry.getPhase() == Phase.FUNCTIONAL_GROUP_DETECTION)
                entries.add(entry);

        return entries;
    }


    public List<NamingWarning> getWarnings()
    {
        return warnings;
    }


    public boolean hasWarning(NamingWarning.Type type)
    {
        for(NamingWarning warning : warnings)
            if(warning.getType() == type)
                return true;

        return false;
    }


    public boolean isError()
    {
        return error;
    }


    @Override
    public String toString()
    {
        return error ? "<error>" : name;
    }
}
