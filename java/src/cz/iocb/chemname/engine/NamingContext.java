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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.parent.RingSystem;
import cz.iocb.chemname.rules.NomenclatureTables;
import cz.iocb.chemname.substituent.Substituent;
import cz.iocb.chemname.substituent.SubstituentAssembler;



/**
 * Immutable state of one naming invocation. Rules derive new states through {@link #withStateUpdate()}.
 */
public final class NamingContext
{
    public static enum Method
    {
        SYSTEMATIC("systematic"),
        FUNCTIONAL_CLASS("functional-class"),
        RETAINED("retained"),
        FALLBACK("fallback");


        private final String label;


        private Method(String label)
        {
            this.label = label;
        }


        @Override
        public String toString()
        {
            return label;
        }
    }


    public static final class Builder
    {
        private final Molecule molecule;
        private final NomenclatureTables tables;
        private Phase phase;
        private List<RingSystem> ringSystems;
        private SubstituentAssembler assembler;
        private List<FunctionalGroup> groups;
        private Set<Integer> blocked;
        private List<FunctionalGroup> esters;
        private ParentStructure parent;
        private List<Substituent> substituents;
        private List<Substituent> esterComponents;
        private String name;
        private Method method;
        private final List<TraceEntry> trace;
        private final List<NamingWarning> warnings;
        private double confidence;
        private boolean error;


        private Builder(Molecule molecule, NomenclatureTables tables)
        {
            this.molecule = molecule;
            this.tables = tables;
            this.phase = Phase.FUNCTIONAL_GROUP_DETECTION;
            this.ringSystems = Collections.emptyList();
            this.groups = Collections.emptyList();
            this.blocked = Collections.emptySet();
            this.esters = Collections.emptyList();
            this.substituents = Collections.emptyList();
            this.esterComponents = Collections.emptyList();
            this.trace = new ArrayList<TraceEntry>();
            this.warnings = new ArrayList<NamingWarning>();
            this.confidence = 1.0;
        }


        private Builder(NamingContext context)
        {
            this.molecule = context.molecule;
            this.tables = context.tables;
            this.phase = context.phase;
            this.ringSystems = context.ringSystems;
            this.assembler = context.assembler;
            this.groups = context.groups;
            this.blocked = context.blocked;
            this.esters = context.esters;
            this.parent = context.parent;
            this.substituents = context.substituents;
            this.esterComponents = context.esterComponents;
            this.name = context.name;
            this.method = context.method;
            this.trace = new ArrayList<TraceEntry>(context.trace);
            this.warnings = new ArrayList<NamingWarning>(context.warnings);
            this.confidence = context.confidence;
            this.error = context.error;
        }


        public Builder phase(Phase phase)
        {
            this.phase = phase;
            return this;
        }


        public Builder ringSystems(List<RingSystem> ringSystems)
        {
            this.ringSystems = Collections.unmodifiableList(new ArrayList<RingSystem>(ringSystems));
            return this;
        }


        public Builder assembler(SubstituentAssembler assembler)
        {
            this.assembler = assembler;
            return this;
        }


        public Builder groups(List<FunctionalGroup> groups)
        {
            this.groups = Collections.unmodifiableList(new ArrayList<FunctionalGroup>(groups));
            return this;
        }


        public Builder blocked(Set<Integer> blocked)
        {
            this.blocked = Collections.unmodifiableSet(new HashSet<Integer>(blocked));
            return this;
        }


        public Builder esters(List<FunctionalGroup> esters)
        {
            this.esters = Collections.unmodifiableList(new ArrayList<FunctionalGroup>(esters));
            return this;
        }


        public Builder parent(ParentStructure parent)
        {
            this.parent = parent;
            return this;
        }


        public Builder substituents(List<Substituent> substituents)
        {
            this.substituents = Collections.unmodifiableList(new ArrayList<Substituent>(substituents));
            return this;
        }


        public Builder esterComponents(List<Substituent> esterComponents)
        {
            this.esterComponents = Collections.unmodifiableList(new ArrayList<Substituent>(esterComponents));
            return this;
        }


        public Builder name(String name, Method method)
        {
            this.name = name;
            this.method = method;
            return this;
        }


        public Builder trace(TraceEntry entry)
        {
            trace.add(entry);
            return this;
        }


        public Builder warning(NamingWarning warning)
        {
            warnings.add(warning);
            confidence *= warning.getType().getPenalty();
            return this;
        }


        public Builder confidence(double factor)
        {
            confidence *= factor;
            return this;
        }


        /**
         * Marks the invocation as failed: the name is empty and the confidence zero.
         */
        public Builder error(NamingWarning warning)
        {
            warning(warning);
            this.error = true;
            this.name = "";
            this.method = null;
            this.confidence = 0.0;
            return this;
        }


        public NamingContext build()
        {
            return new NamingContext(this);
        }
    }


    private final Molecule molecule;
    private final NomenclatureTables tables;
    private final Phase phase;
    private final List<RingSystem> ringSystems;
    private final SubstituentAssembler assembler;
    private final List<FunctionalGroup> groups;
    private final Set<Integer> blocked;
    private final List<FunctionalGroup> esters;
    private final ParentStructure parent;
    private final List<Substituent> substituents;
    private final List<Substituent> esterComponents;
    private final String name;
    private final Method method;
    private final List<TraceEntry> trace;
    private final List<NamingWarning> warnings;
    private final double confidence;
    private final boolean error;


    private NamingContext(Builder builder)
    {
        this.molecule = builder.molecule;
        this.tables = builder.tables;
        this.phase = builder.phase;
        this.ringSystems = builder.ringSystems;
        this.assembler = builder.assembler;
        this.groups = builder.groups;
        this.blocked = builder.blocked;
        this.esters = builder.esters;
        this.parent = builder.parent;
        this.substituents = builder.substituents;
        this.esterComponents = builder.esterComponents;
        this.name = builder.name;
        this.method = builder.method;
        this.trace = Collections.unmodifiableList(new ArrayList<TraceEntry>(builder.trace));
        this.warnings = Collections.unmodifiableList(new ArrayList<NamingWarning>(builder.warnings));
        this.confidence = builder.confidence;
        this.error = builder.error;
    }


    public static NamingContext create(Molecule molecule, NomenclatureTables tables)
    {
        return new Builder(molecule, tables).build();
    }


    /**
     * @return builder initialized with the state of this context
     */
    public Builder withStateUpdate()
    {
        return new Builder(this);
    }


    public Molecule getMolecule()
    {
        return molecule;
    }


    public NomenclatureTables getTables()
    {
        return tables;
    }


    public Phase getPhase()
    {
        return phase;
    }


    public List<RingSystem> getRingSystems()
    {
        return ringSystems;
    }


    /**
     * The assembler is the one mutable member of the context: it memoizes fragment names. It is created once per
     * molecule by {@link FunctionalGroupRule} and every context derived from that one shares it, so it must never be
     * passed to a context of another invocation.
     *
     * @return substituent namer of this invocation, or null before the detection phase
     */
    public SubstituentAssembler getAssembler()
    {
        return assembler;
    }


    public List<FunctionalGroup> getGroups()
    {
        return groups;
    }


    public List<FunctionalGroup> getPrincipalGroups()
    {
        List<FunctionalGroup> principal = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : groups)
            if(group.isPrincipal())
                principal.add(group);

        return principal;
    }


    /**
     * @return atoms that belong to functional class components and may not be part of the parent
     */
    public Set<Integer> getBlocked()
    {
        return blocked;
    }


    /**
     * @return principal ester groups named by functional class nomenclature
     */
    public List<FunctionalGroup> getEsters()
    {
        return esters;
    }


    public ParentStructure getParent()
    {
        return parent;
    }


    /**
     * @return atoms that no prefix of the parent may contain: functional class components and the atoms of the
     *         principal groups lying outside the parent
     */
    public Set<Integer> getExcludedAtoms()
    {
        Set<Integer> excluded = new HashSet<Integer>(blocked);

        for(FunctionalGroup group : getPrincipalGroups())
            for(int atom : group.getAtoms())
                if(parent == null || !parent.contains(atom))
                    excluded.add(atom);

        return excluded;
    }


    public List<Substituent> getSubstituents()
    {
        return substituents;
    }


    public List<Substituent> getEsterComponents()
    {
        return esterComponents;
    }


    public String getName()
    {
        return name;
    }


    public Method getMethod()
    {
        return method;
    }


    public List<TraceEntry> getTrace()
    {
        return trace;
    }


    public List<NamingWarning> getWarnings()
    {
        return warnings;
    }


    public double getConfidence()
    {
        return confidence;
    }


    public boolean isError()
    {
        return error;
    }
}
