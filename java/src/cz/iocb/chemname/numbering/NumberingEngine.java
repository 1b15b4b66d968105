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
package cz.iocb.chemname.numbering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;



/**
 * Selects the numbering of a skeleton by the lowest locant rules (P-31.1.4). Each criterion is a locant vector; the
 * candidates are reduced criterion by criterion, comparing vectors term by term at the first point of difference.
 */
public class NumberingEngine
{
    private static final Logger LOGGER = LogManager.getLogger(NumberingEngine.class);

    public static final int CRITERIA = 8;


    public static final class Result
    {
        private final Numbering numbering;
        private final boolean ambiguous;
        private final int criterion;


        Result(Numbering numbering, boolean ambiguous, int criterion)
        {
            this.numbering = numbering;
            this.ambiguous = ambiguous;
            this.criterion = criterion;
        }


        public Numbering getNumbering()
        {
            return numbering;
        }


        /**
         * @return whether distinguishable numberings remained tied after all rules and the atom order decided
         */
        public boolean isAmbiguous()
        {
            return ambiguous;
        }


        /**
         * @return index of the criterion that decided, or {@link #CRITERIA} when the fallback decided
         */
        public int getCriterion()
        {
            return criterion;
        }
    }


    private static final Comparator<Locant> locantOrder = new Comparator<Locant>()
    {
        @Override
        public int compare(Locant a, Locant b)
        {
            return a.compareTo(b);
        }
    };


    public Result choose(List<Numbering> candidates, NumberingFeatures features)
    {
        if(candidates.isEmpty())
            throw new IllegalArgumentException("no candidate numbering");

        List<Numbering> remaining = new ArrayList<Numbering>(candidates);

        if(remaining.size() == 1)
            return new Result(remaining.get(0), false, 0);

        for(int criterion = 0; criterion < CRITERIA; criterion++)
        {
            remaining = reduce(remaining, features, criterion);

            if(remaining.size() == 1)
                return new Result(remaining.get(0), false, criterion);
        }

        String signature = signature(remaining.get(0), features);
        boolean ambiguous = false;

        for(Numbering numbering : remaining)
            if(!signature(numbering, features).equals(signature))
                ambiguous = true;

        Numbering best = remaining.get(0);

        for(Numbering numbering : remaining)
            if(compareAtomOrder(numbering, best) < 0)
                best = numbering;

        if(ambiguous)
            LOGGER.debug("{} numberings remain tied, using atom order fallback", remaining.size());

        return new Result(best, ambiguous, CRITERIA);
    }


    /**
     * Compares two numberings by all criteria.
     *
     * @return negative if the first numbering is preferred
     */
    public int compare(Numbering a, Numbering b, NumberingFeatures features)
    {
        for(int criterion = 0; criterion < CRITERIA; criterion++)
        {
            int result = compareVectors(vector(a, features, criterion), vector(b, features, criterion));

            if(result != 0)
                return result;
        }

        return 0;
    }


    private static List<Numbering> reduce(List<Numbering> candidates, NumberingFeatures features, int criterion)
    {
        List<Numbering> best = new ArrayList<Numbering>();
        List<Locant> bestVector = null;

        for(Numbering numbering : candidates)
        {
            List<Locant> vector = vector(numbering, features, criterion);
            int result = bestVector == null ? -1 : compareVectors(vector, bestVector);

            if(result < 0)
            {
                best.clear();
                bestVector = vector;
            }

            if(result <= 0)
                best.add(numbering);
        }

        return best;
    }


    /**
     * Locant vector of the numbering for one criterion:
     * <ol start="0">
     * <li>skeletal heteroatoms as a set</li>
     * <li>skeletal heteroatoms in order of seniority</li>
     * <li>indicated hydrogen</li>
     * <li>principal characteristic groups and free valences</li>
     * <li>multiple bonds</li>
     * <li>double bonds</li>
     * <li>substituent prefixes as a set</li>
     * <li>substituent prefixes in order of citation</li>
     * </ol>
     */
    public static List<Locant> vector(Numbering numbering, NumberingFeatures features, int criterion)
    {
        List<Locant> vector = new ArrayList<Locant>();

        switch(criterion)
        {
            case 0:
                for(NumberingFeatures.Heteroatom heteroatom : features.heteroatoms)
                    vector.add(numbering.getLocant(heteroatom.atom));
                Collections.sort(vector, locantOrder);
                break;

            case 1:
                List<NumberingFeatures.Heteroatom> heteroatoms = new ArrayList<NumberingFeatures.Heteroatom>(
                        features.heteroatoms);
                Collections.sort(heteroatoms, new Comparator<NumberingFeatures.Heteroatom>()
                {
                    @Override
                    public int compare(NumberingFeatures.Heteroatom a, NumberingFeatures.Heteroatom b)
                    {
                        if(a.seniority != b.seniority)
                            return Integer.compare(a.seniority, b.seniority);

                        return numbering.getLocant(a.atom).compareTo(numbering.getLocant(b.atom));
                    }
                });
                for(NumberingFeatures.Heteroatom heteroatom : heteroatoms)
                    vector.add(numbering.getLocant(heteroatom.atom));
                break;

            case 2:
                addSorted(vector, numbering, features.indicatedHydrogens);
                break;

            case 3:
                addSorted(vector, numbering, features.principalAtoms);
                break;

            case 4:
            case 5:
                for(NumberingFeatures.MultipleBond bond : features.multipleBonds)
                {
                    if(criterion == 5 && !bond.isDouble)
                        continue;

                    Locant a = numbering.getLocant(bond.atom1);
                    Locant b = numbering.getLocant(bond.atom2);
                    vector.add(a.compareTo(b) < 0 ? a : b);
                }
                Collections.sort(vector, locantOrder);
                break;

            case 6:
                List<Integer> atoms = new ArrayList<Integer>();
                for(NumberingFeatures.Site site : features.substituents)
                    atoms.add(site.atom);
                addSorted(vector, numbering, atoms);
                break;

            case 7:
                List<NumberingFeatures.Site> sites = new ArrayList<NumberingFeatures.Site>(features.substituents);
                Collections.sort(sites, new Comparator<NumberingFeatures.Site>()
                {
                    @Override
                    public int compare(NumberingFeatures.Site a, NumberingFeatures.Site b)
                    {
                        String keyA = a.key == null ? "" : a.key;
                        String keyB = b.key == null ? "" : b.key;

                        if(!keyA.equals(keyB))
                            return keyA.compareTo(keyB);

                        return numbering.getLocant(a.atom).compareTo(numbering.getLocant(b.atom));
                    }
                });
                for(NumberingFeatures.Site site : sites)
                    vector.add(numbering.getLocant(site.atom));
                break;

            default:
                throw new IllegalArgumentException("unknown criterion " + criterion);
        }

        return vector;
    }


    private static void addSorted(List<Locant> vector, Numbering numbering, List<Integer> atoms)
    {
        for(int atom : atoms)
            vector.add(numbering.getLocant(atom));

        Collections.sort(vector, locantOrder);
    }


    /**
     * First point of difference comparison of two locant vectors.
     */
    public static int compareVectors(List<Locant> a, List<Locant> b)
    {
        for(int i = 0; i < Math.min(a.size(), b.size()); i++)
        {
            int result = a.get(i).compareTo(b.get(i));

            if(result != 0)
                return result;
        }

        return Integer.compare(a.size(), b.size());
    }


    private static int compareAtomOrder(Numbering a, Numbering b)
    {
        for(int i = 0; i < Math.min(a.size(), b.size()); i++)
            if(a.getAtom(i) != b.getAtom(i))
                return Integer.compare(a.getAtom(i), b.getAtom(i));

        return Integer.compare(a.size(), b.size());
    }


    /**
     * Describes what each locant carries. Numberings of a symmetric skeleton have equal signatures. The criteria
     * compare prefixes by their keys only, so two numberings can tie and still differ in the prefix names they put on
     * a locant.
     */
    private static String signature(Numbering numbering, NumberingFeatures features)
    {
        StringBuilder builder = new StringBuilder();

        for(int criterion = 0; criterion < CRITERIA; criterion++)
            builder.append(vector(numbering, features, criterion)).append(';');

        List<String> entries = new ArrayList<String>();

        for(NumberingFeatures.Site site : features.substituents)
            entries.add(numbering.getLocant(site.atom) + ":" + site.name);

        for(NumberingFeatures.Heteroatom heteroatom : features.heteroatoms)
            entries.add(numbering.getLocant(heteroatom.atom) + "@" + heteroatom.seniority);

        Collections.sort(entries);
        return builder.append(entries).toString();
    }
}
