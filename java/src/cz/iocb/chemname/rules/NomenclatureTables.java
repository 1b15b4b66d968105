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
package cz.iocb.chemname.rules;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.exception.CDKException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.iocb.chemname.group.GroupType;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.molecule.StructuralException;



/**
 * Static rule and alias data of the naming engine. Instances are immutable after loading and may be shared by any
 * number of threads.
 */
public class NomenclatureTables
{
    public static final String DEFAULT_RESOURCE = "/nomenclature-rules.json";

    private static final Logger LOGGER = LogManager.getLogger(NomenclatureTables.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static volatile NomenclatureTables defaultTables;


    public static class Heteroatom
    {
        @JsonProperty("element")
        private String element;

        @JsonProperty("prefix")
        private String prefix;

        @JsonProperty("hantzschWidmanGroup")
        private String hantzschWidmanGroup;


        public String getElement()
        {
            return element;
        }


        public String getPrefix()
        {
            return prefix;
        }


        public String getHantzschWidmanGroup()
        {
            return hantzschWidmanGroup;
        }
    }


    public static class HantzschWidmanStem
    {
        @JsonProperty("size")
        private int size;

        @JsonProperty("group")
        private String group;

        @JsonProperty("unsaturated")
        private String unsaturated;

        @JsonProperty("saturated")
        private String saturated;

        @JsonProperty("nitrogenUnsaturated")
        private String nitrogenUnsaturated;

        @JsonProperty("nitrogenSaturated")
        private String nitrogenSaturated;


        public int getSize()
        {
            return size;
        }


        public String getGroup()
        {
            return group;
        }


        public String getStem(boolean saturated, boolean nitrogen)
        {
            if(nitrogen && saturated && nitrogenSaturated != null)
                return nitrogenSaturated;

            if(nitrogen && !saturated && nitrogenUnsaturated != null)
                return nitrogenUnsaturated;

            return saturated ? this.saturated : unsaturated;
        }
    }


    public static class Halogen
    {
        @JsonProperty("prefix")
        private String prefix;

        @JsonProperty("anion")
        private String anion;


        public String getPrefix()
        {
            return prefix;
        }


        public String getAnion()
        {
            return anion;
        }
    }


    public static class GroupNames
    {
        @JsonProperty("suffix")
        private String suffix;

        @JsonProperty("ringSuffix")
        private String ringSuffix;

        @JsonProperty("anionSuffix")
        private String anionSuffix;

        @JsonProperty("ringAnionSuffix")
        private String ringAnionSuffix;

        @JsonProperty("prefix")
        private String prefix;


        /**
         * @param ring whether the carbon atom of the group is attached to a ring (or outside the chain)
         * @param anion whether the anionic form is named
         */
        public String getSuffix(boolean ring, boolean anion)
        {
            if(anion && anionSuffix != null)
                return ring ? ringAnionSuffix : anionSuffix;

            return ring && ringSuffix != null ? ringSuffix : suffix;
        }


        public String getPrefix()
        {
            return prefix;
        }
    }


    private static class TableData
    {
        @JsonProperty("alkaneStems")
        private List<String> alkaneStems;

        @JsonProperty("basicMultipliers")
        private List<String> basicMultipliers;

        @JsonProperty("groupMultipliers")
        private List<String> groupMultipliers;

        @JsonProperty("cycleMultipliers")
        private List<String> cycleMultipliers;

        @JsonProperty("multiplierAliases")
        private Map<String, List<String>> multiplierAliases;

        @JsonProperty("retainedNames")
        private Map<String, List<String>> retainedNames;

        @JsonProperty("retainedBridgedNames")
        private Map<String, List<String>> retainedBridgedNames;

        @JsonProperty("heteroatoms")
        private List<Heteroatom> heteroatoms;

        @JsonProperty("hantzschWidmanStems")
        private List<HantzschWidmanStem> hantzschWidmanStems;

        @JsonProperty("halogens")
        private Map<String, Halogen> halogens;

        @JsonProperty("groups")
        private Map<GroupType, GroupNames> groups;

        @JsonProperty("alkoxyNames")
        private Map<String, String> alkoxyNames;

        @JsonProperty("acylNames")
        private Map<String, String> acylNames;

        @JsonProperty("ringTemplates")
        private List<RingTemplate> ringTemplates;
    }


    private final List<String> alkaneStems;
    private final List<String> basicMultipliers;
    private final List<String> groupMultipliers;
    private final List<String> cycleMultipliers;
    private final AliasTable multiplierAliases;
    private final AliasTable retainedNames;
    private final AliasTable retainedBridgedNames;
    private final List<Heteroatom> heteroatoms;
    private final Map<String, Heteroatom> heteroatomMap;
    private final List<HantzschWidmanStem> hantzschWidmanStems;
    private final Map<String, Halogen> halogens;
    private final Map<GroupType, GroupNames> groups;
    private final Map<String, String> alkoxyNames;
    private final Map<String, String> acylNames;
    private final List<RingTemplate> ringTemplates;


    private NomenclatureTables(TableData data)
    {
        if(data.alkaneStems == null || data.basicMultipliers == null || data.groupMultipliers == null
                || data.cycleMultipliers == null || data.heteroatoms == null || data.hantzschWidmanStems == null
                || data.halogens == null || data.groups == null || data.ringTemplates == null)
            throw new NomenclatureTablesException("incomplete nomenclature tables");

        alkaneStems = Collections.unmodifiableList(new ArrayList<String>(data.alkaneStems));
        basicMultipliers = Collections.unmodifiableList(new ArrayList<String>(data.basicMultipliers));
        groupMultipliers = Collections.unmodifiableList(new ArrayList<String>(data.groupMultipliers));
        cycleMultipliers = Collections.unmodifiableList(new ArrayList<String>(data.cycleMultipliers));

        multiplierAliases = new AliasTable("multipliers", nonNull(data.multiplierAliases));
        retainedNames = new AliasTable("retained names", nonNull(data.retainedNames));
        retainedBridgedNames = new AliasTable("retained bridged names", nonNull(data.retainedBridgedNames));

        heteroatoms = Collections.unmodifiableList(new ArrayList<Heteroatom>(data.heteroatoms));
        heteroatomMap = new HashMap<String, Heteroatom>();

        for(Heteroatom heteroatom : heteroatoms)
            heteroatomMap.put(heteroatom.getElement(), heteroatom);

        hantzschWidmanStems = Collections.unmodifiableList(new ArrayList<HantzschWidmanStem>(data.hantzschWidmanStems));
        halogens = Collections.unmodifiableMap(new HashMap<String, Halogen>(data.halogens));
        groups = Collections.unmodifiableMap(new EnumMap<GroupType, GroupNames>(data.groups));
        alkoxyNames = Collections.unmodifiableMap(new HashMap<String, String>(nonNull(data.alkoxyNames)));
        acylNames = Collections.unmodifiableMap(new HashMap<String, String>(nonNull(data.acylNames)));

        for(RingTemplate template : data.ringTemplates)
        {
            try
            {
                template.initialize(MoleculeCreator.getMolecule(template.getSmiles()));
            }
            catch(CDKException | StructuralException e)
            {
                throw new NomenclatureTablesException("invalid ring template " + template.getName(), e);
            }
        }

        ringTemplates = Collections.unmodifiableList(new ArrayList<RingTemplate>(data.ringTemplates));
    }


    private static <K, V> Map<K, V> nonNull(Map<K, V> map)
    {
        return map == null ? Collections.<K, V> emptyMap() : map;
    }


    public static NomenclatureTables load(InputStream stream) throws IOException
    {
        return new NomenclatureTables(OBJECT_MAPPER.readValue(stream, TableData.class));
    }


    public static NomenclatureTables load(File file) throws IOException
    {
        LOGGER.info("loading nomenclature tables from {}", file);
        return new NomenclatureTables(OBJECT_MAPPER.readValue(file, TableData.class));
    }


    /**
     * Loads the tables bundled with the library. The instance is created once per process.
     */
    public static NomenclatureTables getDefault()
    {
        NomenclatureTables tables = defaultTables;

        if(tables == null)
        {
            synchronized(NomenclatureTables.class)
            {
                tables = defaultTables;

                if(tables == null)
                {
                    try(InputStream stream = NomenclatureTables.class.getResourceAsStream(DEFAULT_RESOURCE))
                    {
                        if(stream == null)
                            throw new NomenclatureTablesException("missing resource " + DEFAULT_RESOURCE);

                        tables = load(stream);
                    }
                    catch(IOException e)
                    {
                        throw new NomenclatureTablesException("cannot read resource " + DEFAULT_RESOURCE, e);
                    }

                    defaultTables = tables;
                }
            }
        }

        return tables;
    }


    public String getAlkaneStem(int length)
    {
        if(length < 1 || length > alkaneStems.size())
            throw new IllegalArgumentException("no alkane stem for " + length + " atoms");

        return alkaneStems.get(length - 1);
    }


    public String getBasicMultiplier(int count)
    {
        return get(basicMultipliers, count, "multiplier");
    }


    public String getGroupMultiplier(int count)
    {
        return get(groupMultipliers, count, "group multiplier");
    }


    public String getCycleMultiplier(int count)
    {
        return get(cycleMultipliers, count, "cycle multiplier");
    }


    private static String get(List<String> list, int index, String what)
    {
        if(index < 0 || index >= list.size())
            throw new IllegalArgumentException("no " + what + " for " + index);

        return list.get(index);
    }


    public AliasTable getMultiplierAliases()
    {
        return multiplierAliases;
    }


    public AliasTable getRetainedNames()
    {
        return retainedNames;
    }


    public AliasTable getRetainedBridgedNames()
    {
        return retainedBridgedNames;
    }


    /**
     * @return heteroatoms in decreasing seniority (O > S > Se > Te > N > ...)
     */
    public List<Heteroatom> getHeteroatoms()
    {
        return heteroatoms;
    }


    public Heteroatom getHeteroatom(String element)
    {
        return heteroatomMap.get(element);
    }


    /**
     * @return seniority rank of a skeletal heteroatom, lower is more senior; carbon and unknown elements rank last
     */
    public int getHeteroatomSeniority(String element)
    {
        Heteroatom heteroatom = heteroatomMap.get(element);
        return heteroatom == null ? Integer.MAX_VALUE : heteroatoms.indexOf(heteroatom);
    }


    public HantzschWidmanStem getHantzschWidmanStem(int size, String group)
    {
        for(HantzschWidmanStem stem : hantzschWidmanStems)
            if(stem.getSize() == size && (stem.getGroup() == null || stem.getGroup().equals(group)))
                return stem;

        return null;
    }


    public Halogen getHalogen(String element)
    {
        return halogens.get(element);
    }


    public GroupNames getGroupNames(GroupType type)
    {
        GroupNames names = groups.get(type);

        if(names == null)
            throw new NomenclatureTablesException("no names for group " + type);

        return names;
    }


    /**
     * @return contracted alkoxy name for the alkyl group ("methoxy" for "methyl"), or null
     */
    public String getAlkoxyName(String alkyl)
    {
        return alkoxyNames.get(alkyl);
    }


    /**
     * @return retained acyl name for the systematic one ("acetyl" for "ethanoyl"), or null
     */
    public String getAcylName(String acyl)
    {
        return acylNames.get(acyl);
    }


    public List<RingTemplate> getRingTemplates()
    {
        return ringTemplates;
    }
}
