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
package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.rules.NomenclatureTables;
import cz.iocb.chemname.rules.NomenclatureTables.HantzschWidmanStem;
import cz.iocb.chemname.rules.NomenclatureTables.Heteroatom;
import cz.iocb.chemname.rules.RingTemplate;



/**
 * Renders the name of a numbered parent structure together with its suffix: alkane stems, retained rings,
 * Hantzsch-Widman and replacement names, von Baeyer and spiro descriptors, hydro/ene/yne endings and indicated
 * hydrogen. Prefixes are not part of this name.
 */
public class ParentNamer
{
    /**
     * Suffix attached to the parent name, e.g. "ol" at locants 1 and 2 for "-1,2-diol".
     */
    public static final class Suffix
    {
        private final String text;
        private final List<Locant> locants;
        private final boolean terminal;
        private final String trailer;


        /**
         * @param text suffix without multiplier
         * @param locants one locant per occurrence
         * @param terminal whether the suffix includes the terminal carbon atom of a chain ("-oic acid")
         */
        public Suffix(String text, List<Locant> locants, boolean terminal)
        {
            this(text, locants, terminal, "");
        }


        /**
         * @param trailer separate word following the suffix (" chloride" of acyl halides)
         */
        public Suffix(String text, List<Locant> locants, boolean terminal, String trailer)
        {
            List<Locant> sorted = new ArrayList<Locant>(locants);
            Collections.sort(sorted);

            this.text = text;
            this.locants = Collections.unmodifiableList(sorted);
            this.terminal = terminal;
            this.trailer = trailer;
        }


        public String getText()
        {
            return text;
        }


        public List<Locant> getLocants()
        {
            return locants;
        }


        public boolean isTerminal()
        {
            return terminal;
        }


        public String getTrailer()
        {
            return trailer;
        }


        public int getCount()
        {
            return locants.size();
        }


        boolean isFreeValence()
        {
            return text.startsWith("yl");
        }
    }


    private static class Unsaturation
    {
        private final List<String> doubles = new ArrayList<String>();
        private final List<String> triples = new ArrayList<String>();
        private Locant first;


        int getCount()
        {
            return doubles.size() + triples.size();
        }
    }


    private final Molecule molecule;
    private final NomenclatureTables tables;


    public ParentNamer(Molecule molecule, NomenclatureTables tables)
    {
        this.molecule = molecule;
        this.tables = tables;
    }


    /**
     * @param parent parent structure with its final numbering
     * @param suffix suffix, or null
     * @param prefixCount number of detachable prefixes cited in front of the parent
     */
    public String name(ParentStructure parent, Suffix suffix, int prefixCount)
    {
        Unsaturation unsaturation = unsaturation(parent);
        int suffixCount = suffix == null ? 0 : suffix.getCount();
        String base;

        switch(parent.getKind())
        {
            case CHAIN:
            {
                String stem = tables.getAlkaneStem(parent.getSize());

                if(isContracted(suffix, unsaturation))
                    return stem + suffix.getText();

                boolean cite = !(parent.getSize() <= 2
                        || parent.getSize() == 3 && unsaturation.getCount() == 1 && suffixCount == 0 && prefixCount == 0);
                base = hydrocarbon(stem, unsaturation, cite);
                break;
            }

            case SIMPLE_RING:
            {
                SimpleRing ring = (SimpleRing) parent;
                int heteroatoms = countHeteroatoms(parent);

                if(ring.getTemplate() != null)
                {
                    if(suffix != null && suffix.isFreeValence() && suffixCount == 1
                            && ring.getTemplate().getSubstituent() != null)
                        return ring.getTemplate().getSubstituent();

                    base = indicatedHydrogen(parent) + ring.getTemplate().getName();
                }
                else if(ring.isMancude())
                {
                    base = indicatedHydrogen(parent) + hantzschWidman(parent, false);
                }
                else if(heteroatoms > 0 && parent.getSize() <= RingParents.MAX_HANTZSCH_WIDMAN_SIZE)
                {
                    base = ene(hantzschWidman(parent, true), unsaturation);
                }
                else
                {
                    String stem = "cyclo" + tables.getAlkaneStem(parent.getSize());

                    if(heteroatoms > 0)
                        stem = replacementPrefixes(parent) + stem;
                    else if(isContracted(suffix, unsaturation))
                        return stem + suffix.getText();

                    boolean cite = !(heteroatoms == 0 && unsaturation.getCount() == 1 && suffixCount == 0
                            && unsaturation.first.equals(Locant.of(1)));
                    base = hydrocarbon(stem, unsaturation, cite);
                }

                break;
            }

            case FUSED_RING_SYSTEM:
                base = indicatedHydrogen(parent) + ((FusedRingSystem) parent).getTemplate().getName();
                break;

            case BRIDGED_RING_SYSTEM:
            {
                BridgedRingSystem system = (BridgedRingSystem) parent;
                String stem = replacementPrefixes(parent) + tables.getCycleMultiplier(system.getRingCount()) + "cyclo"
                        + system.getDescriptor() + tables.getAlkaneStem(parent.getSize());
                base = hydrocarbon(stem, unsaturation, true);

                if(unsaturation.getCount() == 0 && countHeteroatoms(parent) == 0)
                {
                    String retained = tables.getRetainedBridgedNames().getCanonical(base);

                    if(retained != null)
                        base = retained;
                }

                break;
            }

            case SPIRO_RING_SYSTEM:
            {
                SpiroRingSystem system = (SpiroRingSystem) parent;
                String stem = replacementPrefixes(parent) + "spiro[" + system.getSmallRingSize() + "."
                        + system.getLargeRingSize() + "]" + tables.getAlkaneStem(parent.getSize());
                base = hydrocarbon(stem, unsaturation, true);
                break;
            }

            default:
                throw new IllegalArgumentException("unknown parent kind " + parent.getKind());
        }

        return attach(base, suffix, citeSuffixLocants(parent, suffix, prefixCount, unsaturation));
    }


    /**
     * Builds the name without any locants, as used for the lookup of retained names ("ethanoic acid", "benzenol").
     *
     * @return plain name, or null if the parent is not a candidate for a retained name
     */
    public String plainName(ParentStructure parent, Suffix suffix)
    {
        if(suffix == null || suffix.getCount() != 1 || unsaturation(parent).getCount() > 0)
            return null;

        switch(parent.getKind())
        {
            case CHAIN:
                return attach(tables.getAlkaneStem(parent.getSize()) + "ane", suffix, false);

            case SIMPLE_RING:
                RingTemplate template = ((SimpleRing) parent).getTemplate();

                if(template == null || countHeteroatoms(parent) > 0)
                    return null;

                return attach(template.getName(), suffix, false);

            default:
                return null;
        }
    }


    /**
     * Decides whether locants of the prefixes may be omitted: parents of one skeletal atom, monosubstituted ethane and
     * ethene, and homogeneous monocycles bearing a single feature.
     */
    public boolean omitPrefixLocants(ParentStructure parent, Suffix suffix, int prefixCount)
    {
        int suffixCount = suffix == null ? 0 : suffix.getCount();

        if(parent.getSize() == 1)
            return true;

        if(parent.getKind() == ParentStructure.Kind.CHAIN)
            return parent.getSize() == 2 && suffixCount == 0 && prefixCount == 1;

        if(parent.getKind() == ParentStructure.Kind.SIMPLE_RING)
            return countHeteroatoms(parent) == 0 && suffixCount + prefixCount == 1
                    && unsaturation(parent).getCount() == 0;

        return false;
    }


    /**
     * @return whether the name uses a construction without an established rule (partially hydrogenated
     *         heteromonocycles, aromatic polycycles without a retained fusion name)
     */
    public boolean isApproximate(ParentStructure parent)
    {
        switch(parent.getKind())
        {
            case SIMPLE_RING:
                return !parent.isMancude() && countHeteroatoms(parent) > 0
                        && parent.getSize() <= RingParents.MAX_HANTZSCH_WIDMAN_SIZE
                        && unsaturation(parent).getCount() > 0;

            case BRIDGED_RING_SYSTEM:
                return ((BridgedRingSystem) parent).getSystem().isAromatic(molecule);

            default:
                return false;
        }
    }


    /**
     * Joins a name with the following text, dropping the final "e" before a vowel or "y".
     */
    public static String elide(String base, String next)
    {
        if(base.endsWith("e") && !next.isEmpty() && "aeiouy".indexOf(next.charAt(0)) >= 0)
            return base.substring(0, base.length() - 1);

        return base;
    }


    private boolean isContracted(Suffix suffix, Unsaturation unsaturation)
    {
        return suffix != null && suffix.isFreeValence() && suffix.getCount() == 1 && unsaturation.getCount() == 0
                && suffix.getLocants().get(0).equals(Locant.of(1));
    }


    private boolean citeSuffixLocants(ParentStructure parent, Suffix suffix, int prefixCount, Unsaturation unsaturation)
    {
        if(suffix == null || parent.getSize() == 1)
            return false;

        if(parent.getKind() == ParentStructure.Kind.CHAIN)
            return !suffix.isTerminal() && !(parent.getSize() == 2 && suffix.getCount() == 1);

        if(parent.getKind() == ParentStructure.Kind.SIMPLE_RING && countHeteroatoms(parent) == 0)
            return !(suffix.getCount() == 1 && prefixCount == 0 && unsaturation.getCount() == 0);

        return true;
    }


    private String attach(String base, Suffix suffix, boolean cite)
    {
        if(suffix == null)
            return base;

        String text = tables.getBasicMultiplier(suffix.getCount()) + suffix.getText();
        StringBuilder builder = new StringBuilder(elide(base, text));

        if(cite)
            builder.append('-').append(Locant.join(suffix.getLocants())).append('-');

        return builder.append(text).append(suffix.getTrailer()).toString();
    }


    private String hydrocarbon(String stem, Unsaturation unsaturation, boolean cite)
    {
        if(unsaturation.getCount() == 0)
            return stem + "ane";

        StringBuilder builder = new StringBuilder(stem);
        int first = unsaturation.doubles.isEmpty() ? unsaturation.triples.size() : unsaturation.doubles.size();

        if(cite && first > 1)
            builder.append('a');

        appendEndings(builder, unsaturation, cite);
        return builder.toString();
    }


    private String ene(String name, Unsaturation unsaturation)
    {
        if(unsaturation.getCount() == 0)
            return name;

        StringBuilder builder = new StringBuilder(elide(name, "e"));
        appendEndings(builder, unsaturation, true);
        return builder.toString();
    }


    private void appendEndings(StringBuilder builder, Unsaturation unsaturation, boolean cite)
    {
        if(!unsaturation.doubles.isEmpty())
        {
            if(cite)
                builder.append('-').append(String.join(",", unsaturation.doubles)).append('-');

            builder.append(tables.getBasicMultiplier(unsaturation.doubles.size())).append("ene");
        }

        if(!unsaturation.triples.isEmpty())
        {
            if(!unsaturation.doubles.isEmpty())
                builder.setLength(builder.length() - 1);

            if(cite)
                builder.append('-').append(String.join(",", unsaturation.triples)).append('-');

            builder.append(tables.getBasicMultiplier(unsaturation.triples.size())).append("yne");
        }
    }


    /**
     * Collects the multiple bonds of a non-mancude parent. A bond is cited by its lower locant, followed by the higher
     * one in parentheses when the two are not consecutive ("5(10)").
     */
    private Unsaturation unsaturation(ParentStructure parent)
    {
        final Numbering numbering = parent.getNumbering();
        Unsaturation unsaturation = new Unsaturation();

        if(parent.isMancude())
            return unsaturation;

        List<int[]> doubles = new ArrayList<int[]>();
        List<int[]> triples = new ArrayList<int[]>();

        for(int position = 0; position < numbering.size(); position++)
        {
            int atom = numbering.getAtom(position);

            for(int i = 0; i < molecule.getDegree(atom); i++)
            {
                int other = molecule.getNeighbour(atom, i);
                Bond bond = molecule.getNeighbourBond(atom, i);

                if(!numbering.contains(other) || numbering.getPosition(other) < position)
                    continue;

                if(bond.getOrder() == Molecule.BondType.DOUBLE)
                    doubles.add(new int[] { position, numbering.getPosition(other) });
                else if(bond.getOrder() == Molecule.BondType.TRIPLE)
                    triples.add(new int[] { position, numbering.getPosition(other) });
            }
        }

        Comparator<int[]> order = new Comparator<int[]>()
        {
            @Override
            public int compare(int[] a, int[] b)
            {
                return a[0] != b[0] ? Integer.compare(a[0], b[0]) : Integer.compare(a[1], b[1]);
            }
        };

        Collections.sort(doubles, order);
        Collections.sort(triples, order);

        for(int[] bond : doubles)
            unsaturation.doubles.add(bondLocant(numbering, bond));

        for(int[] bond : triples)
            unsaturation.triples.add(bondLocant(numbering, bond));

        int first = Integer.MAX_VALUE;

        if(!doubles.isEmpty())
            first = doubles.get(0)[0];

        if(!triples.isEmpty())
            first = Math.min(first, triples.get(0)[0]);

        if(first != Integer.MAX_VALUE)
            unsaturation.first = numbering.getLocantAt(first);

        return unsaturation;
    }


    private static String bondLocant(Numbering numbering, int[] bond)
    {
        String locant = numbering.getLocantAt(bond[0]).toString();

        if(bond[1] != bond[0] + 1)
            locant += "(" + numbering.getLocantAt(bond[1]) + ")";

        return locant;
    }


    private String indicatedHydrogen(ParentStructure parent)
    {
        Numbering numbering = parent.getNumbering();
        List<Locant> locants = new ArrayList<Locant>();

        for(int atom : parent.getAtoms())
            if(SkeletonFeatures.hasIndicatedHydrogen(molecule, atom))
                locants.add(numbering.getLocant(atom));

        if(locants.isEmpty())
            return "";

        Collections.sort(locants);
        StringBuilder builder = new StringBuilder();

        for(Locant locant : locants)
        {
            if(builder.length() > 0)
                builder.append(',');

            builder.append(locant).append('H');
        }

        return builder.append('-').toString();
    }


    /**
     * @return skeletal heteroatoms grouped by element in decreasing seniority, each group sorted by locant
     */
    private List<List<Locant>> heteroatomGroups(ParentStructure parent, List<Heteroatom> elements)
    {
        Numbering numbering = parent.getNumbering();
        List<List<Locant>> groups = new ArrayList<List<Locant>>();

        for(Heteroatom heteroatom : tables.getHeteroatoms())
        {
            List<Locant> locants = new ArrayList<Locant>();

            for(int atom : parent.getAtoms())
                if(molecule.getSymbol(atom).equals(heteroatom.getElement()))
                    locants.add(numbering.getLocant(atom));

            if(!locants.isEmpty())
            {
                Collections.sort(locants);
                groups.add(locants);
                elements.add(heteroatom);
            }
        }

        for(int atom : parent.getAtoms())
            if(!molecule.isCarbon(atom) && tables.getHeteroatom(molecule.getSymbol(atom)) == null)
                throw new IllegalArgumentException("no replacement prefix for skeletal " + molecule.getSymbol(atom));

        return groups;
    }


    private String replacementPrefixes(ParentStructure parent)
    {
        List<Heteroatom> elements = new ArrayList<Heteroatom>();
        List<List<Locant>> groups = heteroatomGroups(parent, elements);
        StringBuilder builder = new StringBuilder();

        for(int i = 0; i < groups.size(); i++)
        {
            if(i > 0)
                builder.append('-');

            builder.append(Locant.join(groups.get(i))).append('-');
            builder.append(tables.getBasicMultiplier(groups.get(i).size())).append(elements.get(i).getPrefix());
        }

        return builder.toString();
    }


    private String hantzschWidman(ParentStructure parent, boolean saturated)
    {
        List<Heteroatom> elements = new ArrayList<Heteroatom>();
        List<List<Locant>> groups = heteroatomGroups(parent, elements);
        List<Locant> locants = new ArrayList<Locant>();
        String prefix = "";
        int count = 0;

        for(int i = 0; i < groups.size(); i++)
        {
            prefix = joinElided(prefix, tables.getBasicMultiplier(groups.get(i).size()) + elements.get(i).getPrefix());
            locants.addAll(groups.get(i));
            count += groups.get(i).size();
        }

        Heteroatom last = elements.get(elements.size() - 1);
        HantzschWidmanStem stem = tables.getHantzschWidmanStem(parent.getSize(), last.getHantzschWidmanGroup());

        if(stem == null)
            throw new IllegalArgumentException("no Hantzsch-Widman stem for ring size " + parent.getSize());

        boolean nitrogen = false;

        for(Heteroatom element : elements)
            if(element.getElement().equals("N"))
                nitrogen = true;

        String name = joinElided(prefix, stem.getStem(saturated, nitrogen)).replace("tetraaz", "tetraz");

        return count > 1 ? Locant.join(locants) + "-" + name : name;
    }


    private static String joinElided(String prefix, String next)
    {
        if(prefix.endsWith("a") && !next.isEmpty() && "aeiou".indexOf(next.charAt(0)) >= 0)
            return prefix.substring(0, prefix.length() - 1) + next;

        return prefix + next;
    }


    private int countHeteroatoms(ParentStructure parent)
    {
        int count = 0;

        for(int atom : parent.getAtoms())
            if(!molecule.isCarbon(atom))
                count++;

        return count;
    }
}
