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
package cz.iocb.chemname.molecule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;



/**
 * Immutable hydrogen-suppressed molecular graph with precomputed ring and aromaticity facts.
 */
public final class Molecule
{
    public static abstract class BondType
    {
        public static final byte NONE = 0;
        public static final byte SINGLE = 1;
        public static final byte DOUBLE = 2;
        public static final byte TRIPLE = 3;
    }


    public static abstract class BondStereo
    {
        public static final byte NONE = 0;
        public static final byte OPPOSITE = 1;
        public static final byte TOGETHER = 2;
        public static final byte UNDEFINED = 3;
    }


    private final Atom[] atoms;
    private final Bond[] bonds;
    private final List<int[]> rings;

    private final int[][] neighbours;
    private final int[][] neighbourBonds;
    private final boolean[] ringAtoms;
    private final boolean[] ringBonds;


    Molecule(Atom[] atoms, Bond[] bonds, List<int[]> rings) throws StructuralException
    {
        this.atoms = atoms;
        this.bonds = bonds;

        int[] degrees = new int[atoms.length];

        for(Bond bond : bonds)
        {
            checkAtom(bond.getAtom1(), "bond " + bond.getId());
            checkAtom(bond.getAtom2(), "bond " + bond.getId());

            if(bond.getAtom1() == bond.getAtom2())
                throw new StructuralException("bond " + bond.getId() + " connects atom " + bond.getAtom1() + " to itself");

            degrees[bond.getAtom1()]++;
            degrees[bond.getAtom2()]++;
        }

        neighbours = new int[atoms.length][];
        neighbourBonds = new int[atoms.length][];

        for(int i = 0; i < atoms.length; i++)
        {
            neighbours[i] = new int[degrees[i]];
            neighbourBonds[i] = new int[degrees[i]];
            degrees[i] = 0;
        }

        for(Bond bond : bonds)
        {
            int a = bond.getAtom1();
            int b = bond.getAtom2();

            neighbours[a][degrees[a]] = b;
            neighbourBonds[a][degrees[a]++] = bond.getId();
            neighbours[b][degrees[b]] = a;
            neighbourBonds[b][degrees[b]++] = bond.getId();
        }


        ringAtoms = new boolean[atoms.length];
        ringBonds = new boolean[bonds.length];
        List<int[]> ringList = new ArrayList<int[]>(rings.size());

        for(int[] ring : rings)
        {
            for(int i = 0; i < ring.length; i++)
            {
                checkAtom(ring[i], "ring " + Arrays.toString(ring));

                Bond bond = getBondInternal(ring[i], ring[(i + 1) % ring.length]);

                if(bond == null)
                    throw new StructuralException("ring " + Arrays.toString(ring) + " is not closed by bonds");

                ringAtoms[ring[i]] = true;
                ringBonds[bond.getId()] = true;
            }

            ringList.add(ring.clone());
        }

        this.rings = Collections.unmodifiableList(ringList);
    }


    private void checkAtom(int atom, String owner) throws StructuralException
    {
        if(atom < 0 || atom >= atoms.length)
            throw new StructuralException(owner + " references missing atom " + atom);
    }


    private Bond getBondInternal(int a, int b)
    {
        if(a < 0 || a >= atoms.length)
            return null;

        for(int i = 0; i < neighbours[a].length; i++)
            if(neighbours[a][i] == b)
                return bonds[neighbourBonds[a][i]];

        return null;
    }


    public int getAtomCount()
    {
        return atoms.length;
    }


    public int getBondCount()
    {
        return bonds.length;
    }


    public Atom getAtom(int id)
    {
        return atoms[id];
    }


    public Bond getBond(int id)
    {
        return bonds[id];
    }


    /**
     * @return bond between two atoms, or null if they are not bonded
     */
    public Bond getBond(int a, int b)
    {
        return getBondInternal(a, b);
    }


    public int getDegree(int atom)
    {
        return neighbours[atom].length;
    }


    public int getNeighbour(int atom, int index)
    {
        return neighbours[atom][index];
    }


    public Bond getNeighbourBond(int atom, int index)
    {
        return bonds[neighbourBonds[atom][index]];
    }


    public int[] getNeighbours(int atom)
    {
        return neighbours[atom].clone();
    }


    /**
     * @return sum of bond orders to heavy atoms plus the hydrogen count
     */
    public int getValence(int atom)
    {
        int valence = atoms[atom].getHydrogenCount();

        for(int bond : neighbourBonds[atom])
            valence += bonds[bond].getOrder();

        return valence;
    }


    public List<int[]> getRings()
    {
        return rings;
    }


    public boolean isRingAtom(int atom)
    {
        return ringAtoms[atom];
    }


    public boolean isRingBond(int bond)
    {
        return ringBonds[bond];
    }


    public boolean isRingBond(int a, int b)
    {
        Bond bond = getBondInternal(a, b);
        return bond != null && ringBonds[bond.getId()];
    }


    public String getSymbol(int atom)
    {
        return atoms[atom].getSymbol();
    }


    public int getAtomicNumber(int atom)
    {
        return atoms[atom].getAtomicNumber();
    }


    public boolean isCarbon(int atom)
    {
        return atoms[atom].getAtomicNumber() == AtomicNumbers.C;
    }


    /**
     * Counts neighbours of the given element connected by a bond of the given order.
     */
    public int countNeighbours(int atom, int atomicNumber, byte order)
    {
        int count = 0;

        for(int i = 0; i < neighbours[atom].length; i++)
            if(atoms[neighbours[atom][i]].getAtomicNumber() == atomicNumber
                    && bonds[neighbourBonds[atom][i]].getOrder() == order)
                count++;

        return count;
    }
}
