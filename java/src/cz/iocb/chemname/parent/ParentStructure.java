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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.numbering.Numbering;



/**
 * Skeleton that carries the principal characteristic group and the substituent prefixes. The concrete kind is one of
 * {@link Kind}; consumers switch over {@link #getKind()}.
 */
public abstract class ParentStructure
{
    public static enum Kind
    {
        CHAIN, SIMPLE_RING, FUSED_RING_SYSTEM, BRIDGED_RING_SYSTEM, SPIRO_RING_SYSTEM
    }


    private final int[] atoms;
    private final Set<Integer> atomSet;
    private final List<Numbering> candidates;
    private final Numbering numbering;


    protected ParentStructure(int[] atoms, List<Numbering> candidates, Numbering numbering)
    {
        this.atoms = atoms.clone();
        this.candidates = Collections.unmodifiableList(new ArrayList<Numbering>(candidates));
        this.numbering = numbering;

        Set<Integer> set = new HashSet<Integer>();

        for(int atom : atoms)
            set.add(atom);

        this.atomSet = Collections.unmodifiableSet(set);
    }


    public abstract Kind getKind();


    protected abstract ParentStructure copy(Numbering numbering);


    /**
     * @return number of rings of the skeleton (0 for chains)
     */
    public abstract int getRingCount();


    /**
     * @return whether the name of the skeleton already implies the maximum number of non-cumulative double bonds, so
     *         that its multiple bonds are not cited by "ene" endings
     */
    public abstract boolean isMancude();


    public int[] getAtoms()
    {
        return atoms.clone();
    }


    public Set<Integer> getAtomSet()
    {
        return atomSet;
    }


    public boolean contains(int atom)
    {
        return atomSet.contains(atom);
    }


    public int getSize()
    {
        return atoms.length;
    }


    public boolean isRing()
    {
        return getKind() != Kind.CHAIN;
    }


    /**
     * @return all numberings allowed by the nomenclature of this kind of skeleton
     */
    public List<Numbering> getCandidateNumberings()
    {
        return candidates;
    }


    /**
     * @return selected numbering, or null before the numbering phase
     */
    public Numbering getNumbering()
    {
        return numbering;
    }


    public ParentStructure withNumbering(Numbering numbering)
    {
        if(!candidates.contains(numbering))
            throw new IllegalArgumentException("numbering is not valid for " + this);

        return copy(numbering);
    }


    protected static List<Numbering> cyclicNumberings(int[] ring)
    {
        List<Numbering> numberings = new ArrayList<Numbering>();
        int size = ring.length;

        for(int start = 0; start < size; start++)
        {
            for(int direction = -1; direction <= 1; direction += 2)
            {
                int[] order = new int[size];

                for(int i = 0; i < size; i++)
                    order[i] = ring[((start + direction * i) % size + size) % size];

                numberings.add(Numbering.sequential(order));
            }
        }

        return numberings;
    }


    @Override
    public String toString()
    {
        return getKind() + Arrays.toString(atoms);
    }
}
