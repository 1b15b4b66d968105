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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.group.GroupType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.numbering.NumberingEngine;
import cz.iocb.chemname.numbering.NumberingFeatures;
import cz.iocb.chemname.rules.NomenclatureTables;



/**
 * Chooses the parent structure (P-44): the skeleton with the most principal characteristic groups; rings before
 * chains; then the ring or chain seniority criteria; finally the lowest locants of the best numbering.
 */
public class ParentSelector
{
    private static final Logger LOGGER = LogManager.getLogger(ParentSelector.class);

    private final Molecule molecule;
    private final NomenclatureTables tables;
    private final NumberingEngine engine = new NumberingEngine();


    private class Candidate
    {
        private final ParentStructure parent;
        private final int principalCount;
        private final int heteroatoms;
        private final boolean nitrogen;
        private final NumberingFeatures features;
        private final Numbering numbering;


        Candidate(ParentStructure parent, List<FunctionalGroup> principal, Set<Integer> blocked)
        {
            this.parent = parent;

            Set<Integer> excluded = new HashSet<Integer>(blocked);
            features = SkeletonFeatures.collect(molecule, parent, tables);
            int count = 0;

            for(FunctionalGroup group : principal)
            {
                int anchor = anchorOf(molecule, group, parent);

                if(anchor >= 0)
                {
                    count++;
                    features.addPrincipalAtom(anchor);

                    for(int atom : group.getAtoms())
                        if(!parent.contains(atom))
                            excluded.add(atom);
                }
            }

            for(Branch branch : Branch.find(molecule, parent.getAtomSet(), excluded))
                features.addSubstituent(branch.getAttachment(), null);

            int hetero = 0;
            boolean hasNitrogen = false;

            for(int atom : parent.getAtoms())
            {
                if(!molecule.isCarbon(atom))
                    hetero++;

                if(molecule.getSymbol(atom).equals("N"))
                    hasNitrogen = true;
            }

            this.principalCount = count;
            this.heteroatoms = hetero;
            this.nitrogen = hasNitrogen;
            this.numbering = engine.choose(parent.getCandidateNumberings(), features).getNumbering();
        }
    }


    public ParentSelector(Molecule molecule, NomenclatureTables tables)
    {
        this.molecule = molecule;
        this.tables = tables;
    }


    /**
     * Locates the skeletal atom carrying the group. On chains, groups whose suffix includes the carbon atom count only
     * when that carbon is a chain atom.
     *
     * @return anchor atom, or -1 if the group is not attached to the parent
     */
    public static int anchorOf(Molecule molecule, FunctionalGroup group, ParentStructure parent)
    {
        if(parent.getKind() == ParentStructure.Kind.CHAIN && group.getType().isCarbonIncluded())
            return parent.contains(group.getCarbon()) ? group.getCarbon() : -1;

        return group.getAnchor(molecule, parent.getAtomSet());
    }


    /**
     * @param groups detected groups with the principal ones flagged
     * @param systems ring systems of the molecule
     * @param blocked atoms that may not be part of the parent (functional class components)
     * @return the senior parent structure, or null if the molecule has no skeleton to name
     */
    public ParentStructure select(List<FunctionalGroup> groups, List<RingSystem> systems, Set<Integer> blocked)
    {
        List<FunctionalGroup> principal = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : groups)
            if(group.isPrincipal())
                principal.add(group);

        List<ParentStructure> parents = new ArrayList<ParentStructure>();

        for(RingSystem system : systems)
        {
            boolean free = true;

            for(int atom : system.getAtoms())
                if(blocked.contains(atom))
                    free = false;

            if(free)
                parents.add(RingParents.create(molecule, system, tables));
        }

        for(int[] path : new ChainFinder(molecule, eligibleChainAtoms(groups, blocked)).findChains())
            parents.add(new Chain(path));

        Candidate best = null;

        for(ParentStructure parent : parents)
        {
            Candidate candidate = new Candidate(parent, principal, blocked);

            if(best == null || compare(candidate, best) < 0)
                best = candidate;
        }

        if(best == null)
            return null;

        LOGGER.debug("selected parent {} out of {} candidates", best.parent, parents.size());
        return best.parent;
    }


    /**
     * Acyclic carbon atoms that may form the parent chain. Carbon atoms of cyano groups are always cited as prefixes.
     */
    private boolean[] eligibleChainAtoms(List<FunctionalGroup> groups, Set<Integer> blocked)
    {
        boolean[] eligible = new boolean[molecule.getAtomCount()];

        for(int atom = 0; atom < eligible.length; atom++)
            eligible[atom] = molecule.isCarbon(atom) && !molecule.isRingAtom(atom) && !blocked.contains(atom);

        for(FunctionalGroup group : groups)
            if(group.getType() == GroupType.NITRILE && !group.isPrincipal())
                eligible[group.getCarbon()] = false;

        return eligible;
    }


    private int compare(Candidate a, Candidate b)
    {
        if(a.principalCount != b.principalCount)
            return Integer.compare(b.principalCount, a.principalCount);

        if(a.parent.isRing() != b.parent.isRing())
            return a.parent.isRing() ? -1 : 1;

        if(a.parent.isRing())
        {
            if(a.nitrogen != b.nitrogen)
                return a.nitrogen ? -1 : 1;

            if((a.heteroatoms > 0) != (b.heteroatoms > 0))
                return a.heteroatoms > 0 ? -1 : 1;

            if(a.parent.getRingCount() != b.parent.getRingCount())
                return Integer.compare(b.parent.getRingCount(), a.parent.getRingCount());

            if(a.parent.getSize() != b.parent.getSize())
                return Integer.compare(b.parent.getSize(), a.parent.getSize());

            if(a.heteroatoms != b.heteroatoms)
                return Integer.compare(b.heteroatoms, a.heteroatoms);
        }
        else
        {
            if(a.parent.getSize() != b.parent.getSize())
                return Integer.compare(b.parent.getSize(), a.parent.getSize());

            if(a.features.getMultipleBondCount() != b.features.getMultipleBondCount())
                return Integer.compare(b.features.getMultipleBondCount(), a.features.getMultipleBondCount());

            if(a.features.getDoubleBondCount() != b.features.getDoubleBondCount())
                return Integer.compare(b.features.getDoubleBondCount(), a.features.getDoubleBondCount());
        }

        /* principal group locants, then multiple bond locants */
        for(int criterion = 3; criterion <= 5; criterion++)
        {
            int result = NumberingEngine.compareVectors(NumberingEngine.vector(a.numbering, a.features, criterion),
                    NumberingEngine.vector(b.numbering, b.features, criterion));

            if(result != 0)
                return result;
        }

        if(a.features.getSubstituentCount() != b.features.getSubstituentCount())
            return Integer.compare(b.features.getSubstituentCount(), a.features.getSubstituentCount());

        int result = NumberingEngine.compareVectors(NumberingEngine.vector(a.numbering, a.features, 6),
                NumberingEngine.vector(b.numbering, b.features, 6));

        if(result != 0)
            return result;

        int[] atomsA = a.parent.getAtoms();
        int[] atomsB = b.parent.getAtoms();
        Arrays.sort(atomsA);
        Arrays.sort(atomsB);

        for(int i = 0; i < Math.min(atomsA.length, atomsB.length); i++)
            if(atomsA[i] != atomsB[i])
                return Integer.compare(atomsA[i], atomsB[i]);

        return 0;
    }
}
