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
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.parent.VonBaeyerDescriptor.Bridge;



/**
 * Derives the von Baeyer descriptor and the conforming numberings of a polycyclic ring system (P-23.2).
 *
 * The main ring is the largest simple cycle of the system, the main bridge the longest path between two main ring
 * atoms outside it. The remaining bonds are covered by secondary bridges chosen largest first. All choices that tie
 * are explored and the resulting descriptors compared by {@link VonBaeyerDescriptor#compareTo}.
 */
public class VonBaeyerAnalyzer
{
    private static final Logger LOGGER = LogManager.getLogger(VonBaeyerAnalyzer.class);

    private static final int MAX_RINGS = 16;
    private static final int MAX_CANDIDATES = 50000;


    private static class Candidate
    {
        private final VonBaeyerDescriptor descriptor;
        private final int[] order;


        Candidate(VonBaeyerDescriptor descriptor, int[] order)
        {
            this.descriptor = descriptor;
            this.order = order;
        }
    }


    private final Molecule molecule;
    private final RingSystem system;
    private final int bondCount;

    private final int[] locants;
    private final int[] order;
    private final BitSet covered = new BitSet();
    private final List<Bridge> bridges = new ArrayList<Bridge>();
    private final List<Candidate> candidates = new ArrayList<Candidate>();

    private int numbered;
    private int large;
    private int small;
    private int mainBridge;


    private VonBaeyerAnalyzer(Molecule molecule, RingSystem system)
    {
        this.molecule = molecule;
        this.system = system;
        this.bondCount = system.getBonds().length;
        this.locants = new int[molecule.getAtomCount()];
        this.order = new int[system.getAtomCount()];
    }


    public static BridgedRingSystem analyze(Molecule molecule, RingSystem system)
    {
        if(system.getRank() < 2)
            throw new IllegalArgumentException("von Baeyer nomenclature needs a polycyclic system");

        if(system.getRings().size() > MAX_RINGS)
            throw new IllegalArgumentException("ring system with " + system.getRings().size() + " rings is too large");

        VonBaeyerAnalyzer analyzer = new VonBaeyerAnalyzer(molecule, system);
        analyzer.enumerate();

        if(analyzer.candidates.isEmpty())
            throw new IllegalStateException("no von Baeyer numbering found for " + system);

        VonBaeyerDescriptor best = null;

        for(Candidate candidate : analyzer.candidates)
            if(best == null || candidate.descriptor.compareTo(best) < 0)
                best = candidate.descriptor;

        Set<Numbering> numberings = new LinkedHashSet<Numbering>();

        for(Candidate candidate : analyzer.candidates)
            if(candidate.descriptor.compareTo(best) == 0)
                numberings.add(Numbering.sequential(candidate.order));

        LOGGER.debug("von Baeyer descriptor {} with {} numberings", best, numberings.size());

        return new BridgedRingSystem(system, best, new ArrayList<Numbering>(numberings));
    }


    private void enumerate()
    {
        for(int[] mainRing : findLargestCycles())
        {
            BitSet ringBonds = cycleBonds(mainRing);
            List<List<Integer>> paths = new ArrayList<List<Integer>>();

            for(int atom : mainRing)
            {
                List<Integer> path = new ArrayList<Integer>();
                path.add(atom);
                findBridges(path, ringBonds, mainRing, paths);
            }

            int longest = -1;

            for(List<Integer> path : paths)
                longest = Math.max(longest, path.size() - 2);

            for(List<Integer> path : paths)
                if(path.size() - 2 == longest)
                    numberMainBicycle(mainRing, ringBonds, path);
        }
    }


    private List<int[]> findLargestCycles()
    {
        List<int[]> rings = system.getRings();
        BitSet[] ringBonds = new BitSet[rings.size()];

        for(int r = 0; r < rings.size(); r++)
            ringBonds[r] = cycleBonds(rings.get(r));

        List<int[]> cycles = new ArrayList<int[]>();
        Set<BitSet> seen = new LinkedHashSet<BitSet>();
        int largest = 0;

        for(int mask = 1; mask < 1 << rings.size(); mask++)
        {
            BitSet bonds = new BitSet();

            for(int r = 0; r < rings.size(); r++)
                if((mask & 1 << r) != 0)
                    bonds.xor(ringBonds[r]);

            if(bonds.cardinality() < largest || !seen.add(bonds))
                continue;

            int[] cycle = toCycle(bonds);

            if(cycle == null)
                continue;

            if(cycle.length > largest)
            {
                largest = cycle.length;
                cycles.clear();
            }

            cycles.add(cycle);
        }

        return cycles;
    }


    /**
     * @return atoms of the cycle formed by the bonds in walking order, or null if the bonds do not form one cycle
     */
    private int[] toCycle(BitSet bonds)
    {
        int[] degree = new int[molecule.getAtomCount()];

        for(int b = bonds.nextSetBit(0); b >= 0; b = bonds.nextSetBit(b + 1))
        {
            Bond bond = molecule.getBond(b);

            if(++degree[bond.getAtom1()] > 2 || ++degree[bond.getAtom2()] > 2)
                return null;
        }

        int size = bonds.cardinality();
        int[] cycle = new int[size];
        int previous = -1;
        int current = molecule.getBond(bonds.nextSetBit(0)).getAtom1();

        for(int i = 0; i < size; i++)
        {
            cycle[i] = current;
            int next = -1;

            for(int j = 0; j < molecule.getDegree(current); j++)
            {
                int neighbour = molecule.getNeighbour(current, j);

                if(neighbour != previous && bonds.get(molecule.getNeighbourBond(current, j).getId()))
                {
                    next = neighbour;
                    break;
                }
            }

            if(next < 0)
                return null;

            previous = current;
            current = next;

            if(current == cycle[0] && i < size - 1)
                return null;
        }

        return current == cycle[0] ? cycle : null;
    }


    private BitSet cycleBonds(int[] cycle)
    {
        BitSet bonds = new BitSet();

        for(int i = 0; i < cycle.length; i++)
            bonds.set(molecule.getBond(cycle[i], cycle[(i + 1) % cycle.length]).getId());

        return bonds;
    }


    /**
     * Collects paths from the first atom of the path through atoms outside the main ring to another main ring atom.
     * Each path is recorded once, from its lower to its higher end atom.
     */
    private void findBridges(List<Integer> path, BitSet ringBonds, int[] mainRing, List<List<Integer>> paths)
    {
        int last = path.get(path.size() - 1);

        for(int i = 0; i < molecule.getDegree(last); i++)
        {
            int neighbour = molecule.getNeighbour(last, i);
            int bond = molecule.getNeighbourBond(last, i).getId();

            if(!system.containsBond(bond) || ringBonds.get(bond) || path.contains(neighbour))
                continue;

            if(indexOf(mainRing, neighbour) >= 0)
            {
                if(path.get(0) < neighbour)
                {
                    List<Integer> bridge = new ArrayList<Integer>(path);
                    bridge.add(neighbour);
                    paths.add(bridge);
                }
            }
            else
            {
                path.add(neighbour);
                findBridges(path, ringBonds, mainRing, paths);
                path.remove(path.size() - 1);
            }
        }
    }


    private void numberMainBicycle(int[] mainRing, BitSet ringBonds, List<Integer> bridge)
    {
        int size = mainRing.length;
        int first = bridge.get(0);
        int last = bridge.get(bridge.size() - 1);
        int arc = (indexOf(mainRing, last) - indexOf(mainRing, first) + size) % size - 1;

        large = Math.max(arc, size - 2 - arc);
        small = Math.min(arc, size - 2 - arc);
        mainBridge = bridge.size() - 2;

        for(int head = 0; head < 2; head++)
        {
            int start = head == 0 ? first : last;
            int end = head == 0 ? last : first;

            for(int direction = -1; direction <= 1; direction += 2)
            {
                int from = indexOf(mainRing, start);
                int steps = 0;

                while(mainRing[((from + direction * (steps + 1)) % size + size) % size] != end)
                    steps++;

                if(steps != large)
                    continue;

                numbered = 0;

                for(int i = 0; i < size; i++)
                    assign(mainRing[((from + direction * i) % size + size) % size]);

                for(int i = 1; i < bridge.size() - 1; i++)
                    assign(bridge.get(head == 0 ? i : bridge.size() - 1 - i));

                covered.clear();
                covered.or(ringBonds);

                for(int i = 1; i < bridge.size(); i++)
                    covered.set(molecule.getBond(bridge.get(i - 1), bridge.get(i)).getId());

                addSecondaryBridges();

                for(int i = 0; i < numbered; i++)
                    locants[order[i]] = 0;
            }
        }
    }


    private void assign(int atom)
    {
        order[numbered++] = atom;
        locants[atom] = numbered;
    }


    private void addSecondaryBridges()
    {
        if(candidates.size() >= MAX_CANDIDATES)
            return;

        if(covered.cardinality() == bondCount)
        {
            candidates.add(new Candidate(new VonBaeyerDescriptor(large, small, mainBridge, bridges), order.clone()));
            return;
        }

        List<List<Integer>> paths = new ArrayList<List<Integer>>();

        for(int i = 0; i < numbered; i++)
        {
            List<Integer> path = new ArrayList<Integer>();
            path.add(order[i]);
            findSecondaryBridges(path, paths);
        }

        int longest = -1;

        for(List<Integer> path : paths)
            longest = Math.max(longest, path.size() - 2);

        for(List<Integer> path : paths)
        {
            if(path.size() - 2 != longest)
                continue;

            int saved = numbered;

            for(int i = 1; i < path.size() - 1; i++)
                assign(path.get(i));

            for(int i = 1; i < path.size(); i++)
                covered.set(molecule.getBond(path.get(i - 1), path.get(i)).getId());

            bridges.add(new Bridge(longest, locants[path.get(0)], locants[path.get(path.size() - 1)]));

            addSecondaryBridges();

            bridges.remove(bridges.size() - 1);

            for(int i = 1; i < path.size(); i++)
                covered.clear(molecule.getBond(path.get(i - 1), path.get(i)).getId());

            while(numbered > saved)
                locants[order[--numbered]] = 0;
        }
    }


    /**
     * Collects paths over uncovered bonds through unnumbered atoms. Paths start at the higher-numbered bridgehead, so
     * that bridge atoms are numbered from that end.
     */
    private void findSecondaryBridges(List<Integer> path, List<List<Integer>> paths)
    {
        int last = path.get(path.size() - 1);

        for(int i = 0; i < molecule.getDegree(last); i++)
        {
            int neighbour = molecule.getNeighbour(last, i);
            int bond = molecule.getNeighbourBond(last, i).getId();

            if(!system.containsBond(bond) || covered.get(bond) || path.contains(neighbour))
                continue;

            if(locants[neighbour] > 0)
            {
                if(locants[path.get(0)] > locants[neighbour])
                {
                    List<Integer> bridge = new ArrayList<Integer>(path);
                    bridge.add(neighbour);
                    paths.add(bridge);
                }
            }
            else
            {
                path.add(neighbour);
                findSecondaryBridges(path, paths);
                path.remove(path.size() - 1);
            }
        }
    }


    private static int indexOf(int[] array, int value)
    {
        for(int i = 0; i < array.length; i++)
            if(array[i] == value)
                return i;

        return -1;
    }
}
