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
package cz.iocb.chemname.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.group.GroupType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.parent.ParentNamer;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.rules.NomenclatureTables;
import cz.iocb.chemname.rules.NomenclatureTables.Halogen;
import cz.iocb.chemname.substituent.Prefixes;
import cz.iocb.chemname.substituent.Substituent;



/**
 * Renders the complete name (P-14.5): alphanumerically ordered prefixes, the parent name with its suffix, retained
 * names of common acids and their derivatives (P-65.1.1), and the alkyl components of functional class esters.
 */
public class NameAssembler
{
    public static final class AssembledName
    {
        private final String name;
        private final boolean retained;
        private final boolean functionalClass;
        private final boolean approximate;


        AssembledName(String name, boolean retained, boolean functionalClass, boolean approximate)
        {
            this.name = name;
            this.retained = retained;
            this.functionalClass = functionalClass;
            this.approximate = approximate;
        }


        public String getName()
        {
            return name;
        }


        public boolean isRetained()
        {
            return retained;
        }


        public boolean isFunctionalClass()
        {
            return functionalClass;
        }


        public boolean isApproximate()
        {
            return approximate;
        }


        @Override
        public String toString()
        {
            return name;
        }
    }


    private final Molecule molecule;
    private final NomenclatureTables tables;
    private final ParentNamer namer;


    public NameAssembler(Molecule molecule, NomenclatureTables tables)
    {
        this.molecule = molecule;
        this.tables = tables;
        this.namer = new ParentNamer(molecule, tables);
    }


    /**
     * @param parent numbered parent structure
     * @param principal principal groups with their locants
     * @param substituents prefixes with their locants
     * @param esterComponents alkyl components of functional class esters, or an empty list
     */
    public AssembledName assemble(ParentStructure parent, List<FunctionalGroup> principal,
            List<Substituent> substituents, List<Substituent> esterComponents)
    {
        ParentNamer.Suffix suffix = suffix(parent, principal);

        boolean omit = namer.omitPrefixLocants(parent, suffix, substituents.size());

        for(Substituent substituent : substituents)
            if(substituent.getLocant().isHeteroatom())
                omit = false;

        String prefixes = Prefixes.render(Prefixes.merge(substituents, tables), omit, tables);
        String parentName = namer.name(parent, suffix, substituents.size());
        boolean retained = false;

        String plain = namer.plainName(parent, suffix);

        if(plain != null)
        {
            String canonical = tables.getRetainedNames().getCanonical(plain);

            if(canonical != null)
            {
                parentName = canonical;
                retained = true;
            }
        }

        String name = Prefixes.prepend(prefixes, parentName);

        // retained names that include a prefix, "aminoformate" is "carbamate"
        if(retained)
        {
            String canonical = tables.getRetainedNames().getCanonical(name);

            if(canonical != null)
                name = canonical;
        }

        if(!esterComponents.isEmpty())
            name = esterComponents(esterComponents) + " " + name;

        return new AssembledName(name, retained, !esterComponents.isEmpty(), namer.isApproximate(parent));
    }


    /**
     * @return the suffix expressing the principal groups, or null for parent hydrides
     */
    public ParentNamer.Suffix suffix(ParentStructure parent, List<FunctionalGroup> principal)
    {
        if(principal.isEmpty())
            return null;

        FunctionalGroup first = principal.get(0);
        GroupType type = first.getType();
        boolean ring = parent.isRing() && type.isCarbonIncluded();
        boolean anion = first.getPattern().equals("carboxylate");
        String text = tables.getGroupNames(type).getSuffix(ring, anion);

        List<Locant> locants = new ArrayList<Locant>();

        for(FunctionalGroup group : principal)
            locants.addAll(group.getLocants());

        String trailer = "";

        if(type == GroupType.ACYL_HALIDE)
            trailer = " " + tables.getBasicMultiplier(principal.size()) + halogen(first).getAnion();

        return new ParentNamer.Suffix(text, locants, !parent.isRing() && type.isCarbonIncluded(), trailer);
    }


    private Halogen halogen(FunctionalGroup group)
    {
        for(int atom : group.getAtoms())
        {
            Halogen halogen = tables.getHalogen(molecule.getSymbol(atom));

            if(halogen != null)
                return halogen;
        }

        throw new IllegalStateException("acyl halide without halogen: " + group);
    }


    /**
     * Renders the alkyl components of esters, e.g. "ethyl", "dimethyl" or "ethyl methyl". Substituted components
     * are enclosed in square brackets when they already contain enclosing marks, otherwise in parentheses.
     */
    private String esterComponents(List<Substituent> components)
    {
        Map<String, Integer> counts = new LinkedHashMap<String, Integer>();

        for(Substituent component : components)
        {
            String name = component.getName();

            if(component.isCompound())
                name = name.indexOf('(') >= 0 || name.indexOf('[') >= 0 ? "[" + name + "]" : "(" + name + ")";

            Integer count = counts.get(name);
            counts.put(name, count == null ? 1 : count + 1);
        }

        List<String> names = new ArrayList<String>(counts.keySet());
        Collections.sort(names, new Comparator<String>()
        {
            @Override
            public int compare(String a, String b)
            {
                return Prefixes.key(a).compareTo(Prefixes.key(b));
            }
        });

        StringBuilder builder = new StringBuilder();

        for(String name : names)
        {
            if(builder.length() > 0)
                builder.append(' ');

            builder.append(tables.getBasicMultiplier(counts.get(name))).append(name);
        }

        return builder.toString();
    }
}
