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
import java.util.List;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Groups the SSSR rings of a molecule into ring systems. Rings sharing a bond belong to one system; a ring attached to
 * other rings only through acyclic bonds forms a system of its own.
 */
public class RingSystemAnalyzer
{
    public List<RingSystem> analyze(Molecule molecule)
    {
        List<int[]> rings = molecule.getRings();
        int count = rings.size();

        BitSet[] ringBonds = new BitSet[count];
        BitSet[] ringAtoms = new BitSet[count];

        for(int r = 0; r < count; r++)
        {
            int[] ring = rings.get(r);
            ringBonds[r] = new BitSet();
            ringAtoms[r] = new BitSet();

            for(int i = 0; i < ring.length; i++)
            {
                ringAtoms[r].set(ring[i]);
                ringBonds[r].set(molecule.getBond(ring[i], ring[(i + 1) % ring.length]).getId());
            }
        }


        int[] parent = new int[count];

        for(int r = 0; r < count; r++)
            parent[r] = r;

        for(int r = 0; r < count; r++)
            for(int s = r + 1; s < count; s++)
                if(ringBonds[r].intersects(ringBonds[s]))
                    union(parent, r, s);


        List<List<Integer>> groups = new ArrayList<List<Integer>>();
        int[] groupOf = new int[count];

        for(int r = 0; r < count; r++)
        {
            int root = find(parent, r);

            if(root == r)
            {
                groupOf[r] = groups.size();
                groups.add(new ArrayList<Integer>());
            }
        }

        for(int r = 0; r < count; r++)
            groups.get(groupOf[find(parent, r)]).add(r);


        /* systems sharing one atom are joined into spiro systems */
        int[] spiroParent = new int[groups.size()];
        int[] spiroAtom = new int[groups.size()];

        for(int g = 0; g < groups.size(); g++)
        {
            spiroParent[g] = g;
            spiroAtom[g] = -1;
        }

        for(int g = 0; g < groups.size(); g++)
        {
            for(int h = g + 1; h < groups.size(); h++)
            {
                BitSet shared = atoms(groups.get(g), ringAtoms);
                shared.and(atoms(groups.get(h), ringAtoms));

                if(!shared.isEmpty())
                {
                    union(spiroParent, g, h);
                    spiroAtom[find(spiroParent, g)] = shared.nextSetBit(0);
                }
            }
        }


        List<RingSystem> systems = new ArrayList<RingSystem>();

        for(int g = 0; g < groups.size(); g++)
        {
            if(find(spiroParent, g) != g)
                continue;

            List<int[]> systemRings = new ArrayList<int[]>();
            BitSet atoms = new BitSet();
            BitSet bonds = new BitSet();
            int members = 0;

            for(int h = 0; h < groups.size(); h++)
            {
                if(find(spiroParent, h) != g)
                    continue;

                members++;

                for(int r : groups.get(h))
                {
                    systemRings.add(rings.get(r));
                    atoms.or(ringAtoms[r]);
                    bonds.or(ringBonds[r]);
                }
            }

            RingSystem.Type type;

            if(members > 1)
                type = RingSystem.Type.SPIRO;
            else if(systemRings.size() > 1)
                type = RingSystem.Type.POLYCYCLE;
            else
                type = RingSystem.Type.MONOCYCLE;

            systems.add(new RingSystem(type, toArray(atoms), toArray(bonds), systemRings,
                    type == RingSystem.Type.SPIRO ? spiroAtom[g] : -1));
        }

        return systems;
    }


    /**
     * @return ring system containing the atom, or null
     */
    public static RingSystem findSystem(List<RingSystem> systems, int atom)
    {
        for(RingSystem system : systems)
            if(system.contains(atom))
                return system;

        return null;
    }


    private static BitSet atoms(List<Integer> group, BitSet[] ringAtoms)
    {
        BitSet atoms = new BitSet();

        for(int r : group)
            atoms.or(ringAtoms[r]);

        return atoms;
    }


    private static int[] toArray(BitSet set)
    {
        int[] array = new int[set.cardinality()];
        int index = 0;

        for(int i = set.nextSetBit(0); i >= 0; i = set.nextSetBit(i + 1))
            array[index++] = i;

        return array;
    }


    private static int find(int[] parent, int i)
    {
        while(parent[i] != i)
            i = parent[i] = parent[parent[i]];

        return i;
    }


    private static void union(int[] parent, int a, int b)
    {
        int ra = find(parent, a);
        int rb = find(parent, b);

        if(ra < rb)
            parent[rb] = ra;
        else if(rb < ra)
            parent[ra] = rb;
    }
}
