/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;



/**
 * Folds a naming context over an ordered rule table. Phases are visited in order; within a phase, the rules are tried
 * in table order. A failing rule is recorded as a conflict and the fold continues with the unchanged context.
 */
public class RuleEngine
{
    private static final Logger LOGGER = LogManager.getLogger(RuleEngine.class);

    private final List<Rule> rules;


    public RuleEngine(List<Rule> rules)
    {
        this.rules = Collections.unmodifiableList(new ArrayList<Rule>(rules));
    }


    public List<Rule> getRules()
    {
        return rules;
    }


    public NameResult run(NamingContext initial)
    {
        NamingContext context = initial;

        for(Phase phase = initial.getPhase(); phase != Phase.DONE && !context.isError(); phase = phase.next())
        {
            LOGGER.debug("entering phase {}", phase);
            context = context.withStateUpdate().phase(phase).build();

            for(Rule rule : rules)
            {
                if(rule.getPhase() != phase || context.isError())
                    continue;

                context = apply(rule, context);
            }
        }

        context = context.withStateUpdate().phase(Phase.DONE).build();

        if(context.getName() == null && !context.isError())
        {
            context = context.withStateUpdate()
                    .error(new NamingWarning(NamingWarning.Type.NO_PARENT, "engine", "no name could be assembled"))
                    .build();
        }

        LOGGER.debug("named as '{}' with confidence {}", context.getName(), context.getConfidence());
        return new NameResult(context);
    }


    private NamingContext apply(Rule rule, NamingContext context)
    {
        try
        {
            if(!rule.matches(context))
                return context;

            LOGGER.trace("applying rule {}", rule);
            return rule.apply(context);
        }
        catch(RuntimeException e)
        {
            LOGGER.warn("rule {} failed: {}", rule, e.getMessage());
            LOGGER.debug("rule failure", e);

            String message = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());

            return context.withStateUpdate()
                    .warning(new NamingWarning(NamingWarning.Type.RULE_CONFLICT, rule.getId(), message))
                    .trace(new TraceEntry(rule.getId(), rule.getName(), rule.getReference(), context.getPhase(),
                            "rule failed: " + message, Collections.<Integer> emptyList()))
                    .build();
        }
    }
}
