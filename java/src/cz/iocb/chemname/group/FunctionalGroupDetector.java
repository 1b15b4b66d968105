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
package cz.iocb.chemname.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import cz.iocb.chemname.molecule.AtomicNumbers;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.Molecule.BondType;



/**
 * Finds characteristic groups by matching local structural motifs around each atom.
 */
public class FunctionalGroupDetector
{
    private static final Comparator<FunctionalGroup> seniorityComparator = new Comparator<FunctionalGroup>()
    {
        @Override
        public int compare(FunctionalGroup g1, FunctionalGroup g2)
        {
            if(g1.getPriority() != g2.getPriority())
                return Integer.compare(g1.getPriority(), g2.getPriority());

            return Integer.compare(g1.getAtoms()[0], g2.getAtoms()[0]);
        }
    };


    public List<FunctionalGroup> detect(Molecule molecule)
    {
        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();
        boolean[] used = new boolean[molecule.getAtomCount()];

        for(int atom = 0; atom < molecule.getAtomCount(); atom++)
            if(molecule.isCarbon(atom))
                detectCarbonGroups(molecule, atom, used, groups);

        for(int atom = 0; atom < molecule.getAtomCount(); atom++)
        {
            if(used[atom])
                continue;

            switch(molecule.getAtomicNumber(atom))
            {
                case AtomicNumbers.O:
                    detectOxygenGroups(molecule, atom, used, groups);
                    break;
                case AtomicNumbers.S:
                    detectSulfurGroups(molecule, atom, used, groups);
                    break;
                case AtomicNumbers.N:
                    detectNitrogenGroups(molecule, atom, used, groups);
                    break;
                case AtomicNumbers.F:
                case AtomicNumbers.Cl:
                case AtomicNumbers.Br:
                case AtomicNumbers.I:
                    if(molecule.getDegree(atom) == 1 && molecule.isCarbon(molecule.getNeighbour(atom, 0)))
                        add(groups, used, molecule, GroupType.HALIDE, "halide", -1, -1, false, atom);
                    break;
            }
        }

        Collections.sort(groups, seniorityComparator);
        return groups;
    }


    private void detectCarbonGroups(Molecule molecule, int carbon, boolean[] used, List<FunctionalGroup> groups)
    {
        int doubleOxygen = -1;
        int hydroxyOxygen = -1;
        int etherOxygen = -1;
        int nitrogen = -1;
        int halogen = -1;
        int tripleNitrogen = -1;
        int doubleNitrogen = -1;
        int carbons = 0;

        for(int i = 0; i < molecule.getDegree(carbon); i++)
        {
            int neighbour = molecule.getNeighbour(carbon, i);
            Bond bond = molecule.getNeighbourBond(carbon, i);

            switch(molecule.getAtomicNumber(neighbour))
            {
                case AtomicNumbers.C:
                    carbons++;
                    break;

                case AtomicNumbers.O:
                    if(bond.getOrder() == BondType.DOUBLE && !bond.isAromatic())
                        doubleOxygen = neighbour;
                    else if(bond.getOrder() == BondType.SINGLE && molecule.getDegree(neighbour) == 1)
                        hydroxyOxygen = neighbour;
                    else if(bond.getOrder() == BondType.SINGLE && molecule.getDegree(neighbour) == 2)
                        etherOxygen = neighbour;
                    break;

                case AtomicNumbers.N:
                    if(bond.getOrder() == BondType.TRIPLE && molecule.getDegree(neighbour) == 1)
                        tripleNitrogen = neighbour;
                    else if(bond.getOrder() == BondType.DOUBLE && !molecule.getAtom(neighbour).isAromatic()
                            && !molecule.isRingAtom(neighbour) && !isNitro(molecule, neighbour))
                        doubleNitrogen = neighbour;
                    else if(bond.getOrder() == BondType.SINGLE && !molecule.getAtom(neighbour).isAromatic()
                            && !isNitro(molecule, neighbour))
                        nitrogen = neighbour;
                    break;

                case AtomicNumbers.F:
                case AtomicNumbers.Cl:
                case AtomicNumbers.Br:
                case AtomicNumbers.I:
                    halogen = neighbour;
                    break;
            }
        }


        if(tripleNitrogen >= 0)
        {
            add(groups, used, molecule, GroupType.NITRILE, "nitrile", carbon, -1, false, carbon, tripleNitrogen);
            return;
        }

        if(doubleOxygen >= 0 && molecule.isRingAtom(carbon))
        {
            /* ring carbonyl: lactams and lactones are expressed by the heterocycle name and a "-one" suffix */
            String pattern = "ketone";

            for(int neighbour : molecule.getNeighbours(carbon))
            {
                if(!molecule.isRingBond(carbon, neighbour))
                    continue;

                if(molecule.getAtomicNumber(neighbour) == AtomicNumbers.N)
                    pattern = "lactam";
                else if(molecule.getAtomicNumber(neighbour) == AtomicNumbers.O && !pattern.equals("lactam"))
                    pattern = "lactone";
            }

            add(groups, used, molecule, GroupType.KETONE, pattern, carbon, -1, !pattern.equals("ketone"),
                    doubleOxygen);
            return;
        }

        if(doubleOxygen >= 0)
        {
            if(hydroxyOxygen >= 0 && molecule.getAtomicNumber(hydroxyOxygen) == AtomicNumbers.O
                    && (molecule.getAtom(hydroxyOxygen).getHydrogenCount() > 0
                            || molecule.getAtom(hydroxyOxygen).getCharge() < 0))
            {
                String pattern = molecule.getAtom(hydroxyOxygen).getCharge() < 0 ? "carboxylate" : "carboxylic-acid";
                add(groups, used, molecule, GroupType.CARBOXYLIC_ACID, pattern, carbon, -1, false, carbon,
                        doubleOxygen, hydroxyOxygen);
            }
            else if(etherOxygen >= 0 && !molecule.isRingAtom(etherOxygen) && isEsterOxygen(molecule, etherOxygen))
            {
                add(groups, used, molecule, GroupType.ESTER, "ester", carbon, -1, false, carbon, doubleOxygen,
                        etherOxygen);
            }
            else if(halogen >= 0)
            {
                add(groups, used, molecule, GroupType.ACYL_HALIDE, "acyl-halide", carbon, -1, false, carbon,
                        doubleOxygen, halogen);
            }
            else if(nitrogen >= 0)
            {
                add(groups, used, molecule, GroupType.AMIDE, "amide", carbon, nitrogen, false, carbon, doubleOxygen,
                        nitrogen);
            }
            else if(carbons <= 1 && molecule.getDegree(carbon) == carbons + 1
                    && molecule.getAtom(carbon).getHydrogenCount() > 0)
            {
                add(groups, used, molecule, GroupType.ALDEHYDE, "aldehyde", carbon, -1, false, carbon, doubleOxygen);
            }
            else if(carbons == 2 && molecule.getDegree(carbon) == 3)
            {
                add(groups, used, molecule, GroupType.KETONE, "ketone", carbon, -1, false, doubleOxygen);
            }

            return;
        }

        if(doubleNitrogen >= 0 && !molecule.getAtom(carbon).isAromatic() && isImineNitrogen(molecule, doubleNitrogen))
            add(groups, used, molecule, GroupType.IMINE, "imine", carbon, doubleNitrogen, false, doubleNitrogen);
    }


    private void detectOxygenGroups(Molecule molecule, int oxygen, boolean[] used, List<FunctionalGroup> groups)
    {
        if(molecule.isRingAtom(oxygen) || molecule.getAtom(oxygen).getCharge() != 0)
            return;

        if(molecule.getDegree(oxygen) == 1 && molecule.getNeighbourBond(oxygen, 0).getOrder() == BondType.SINGLE
                && molecule.getAtom(oxygen).getHydrogenCount() > 0)
        {
            int carbon = molecule.getNeighbour(oxygen, 0);

            if(molecule.isCarbon(carbon) && !hasDoubleBondedHeteroatom(molecule, carbon))
                add(groups, used, molecule, GroupType.ALCOHOL, "alcohol", carbon, -1, false, oxygen);
        }
        else if(molecule.getDegree(oxygen) == 2 && molecule.isCarbon(molecule.getNeighbour(oxygen, 0))
                && molecule.isCarbon(molecule.getNeighbour(oxygen, 1)))
        {
            add(groups, used, molecule, GroupType.ETHER, "ether", -1, -1, false, oxygen);
        }
    }


    private void detectSulfurGroups(Molecule molecule, int sulfur, boolean[] used, List<FunctionalGroup> groups)
    {
        if(molecule.isRingAtom(sulfur) || molecule.getAtom(sulfur).getCharge() != 0)
            return;

        if(molecule.getDegree(sulfur) == 1 && molecule.getNeighbourBond(sulfur, 0).getOrder() == BondType.SINGLE
                && molecule.getAtom(sulfur).getHydrogenCount() > 0 && molecule.isCarbon(molecule.getNeighbour(sulfur, 0)))
        {
            add(groups, used, molecule, GroupType.THIOL, "thiol", molecule.getNeighbour(sulfur, 0), -1, false, sulfur);
        }
        else if(molecule.getDegree(sulfur) == 2 && molecule.isCarbon(molecule.getNeighbour(sulfur, 0))
                && molecule.isCarbon(molecule.getNeighbour(sulfur, 1)))
        {
            add(groups, used, molecule, GroupType.THIOETHER, "thioether", -1, -1, false, sulfur);
        }
    }


    private void detectNitrogenGroups(Molecule molecule, int nitrogen, boolean[] used, List<FunctionalGroup> groups)
    {
        if(molecule.isRingAtom(nitrogen) || molecule.getAtom(nitrogen).isAromatic())
            return;

        if(isNitro(molecule, nitrogen))
        {
            int[] atoms = new int[molecule.getDegree(nitrogen)];
            atoms[0] = nitrogen;
            int index = 1;

            for(int neighbour : molecule.getNeighbours(nitrogen))
                if(molecule.getAtomicNumber(neighbour) == AtomicNumbers.O)
                    atoms[index++] = neighbour;

            add(groups, used, molecule, GroupType.NITRO, "nitro", -1, -1, false, atoms);
            return;
        }

        if(molecule.getAtom(nitrogen).getCharge() != 0)
            return;

        boolean carbonOnly = molecule.getDegree(nitrogen) > 0;

        for(int i = 0; i < molecule.getDegree(nitrogen); i++)
        {
            if(molecule.getNeighbourBond(nitrogen, i).getOrder() != BondType.SINGLE)
                return;

            int neighbour = molecule.getNeighbour(nitrogen, i);

            if(!molecule.isCarbon(neighbour) || hasDoubleBondedHeteroatom(molecule, neighbour))
                carbonOnly = false;
        }

        if(carbonOnly)
            add(groups, used, molecule, GroupType.AMINE, "amine", -1, nitrogen, false, nitrogen);
    }


    private static void add(List<FunctionalGroup> groups, boolean[] used, Molecule molecule, GroupType type,
            String pattern, int carbon, int nitrogen, boolean absorbed, int... atoms)
    {
        List<Integer> bonds = new ArrayList<Integer>();

        for(int i = 0; i < atoms.length; i++)
        {
            for(int j = i + 1; j < atoms.length; j++)
            {
                Bond bond = molecule.getBond(atoms[i], atoms[j]);

                if(bond != null)
                    bonds.add(bond.getId());
            }

            if(carbon >= 0 && carbon != atoms[i])
            {
                Bond bond = molecule.getBond(carbon, atoms[i]);

                if(bond != null && !bonds.contains(bond.getId()))
                    bonds.add(bond.getId());
            }
        }

        int[] bondArray = new int[bonds.size()];

        for(int i = 0; i < bondArray.length; i++)
            bondArray[i] = bonds.get(i);

        for(int atom : atoms)
            used[atom] = true;

        groups.add(new FunctionalGroup(type, pattern, atoms, bondArray, carbon, nitrogen, absorbed));
    }


    private static boolean isNitro(Molecule molecule, int nitrogen)
    {
        int oxygens = 0;
        int doubleOxygens = 0;

        for(int i = 0; i < molecule.getDegree(nitrogen); i++)
        {
            int neighbour = molecule.getNeighbour(nitrogen, i);

            if(molecule.getAtomicNumber(neighbour) == AtomicNumbers.O && molecule.getDegree(neighbour) == 1)
            {
                oxygens++;

                if(molecule.getNeighbourBond(nitrogen, i).getOrder() == BondType.DOUBLE)
                    doubleOxygens++;
            }
        }

        return oxygens == 2 && doubleOxygens >= 1;
    }


    private static boolean isEsterOxygen(Molecule molecule, int oxygen)
    {
        for(int neighbour : molecule.getNeighbours(oxygen))
            if(!molecule.isCarbon(neighbour))
                return false;

        return true;
    }


    private static boolean isImineNitrogen(Molecule molecule, int nitrogen)
    {
        for(int i = 0; i < molecule.getDegree(nitrogen); i++)
        {
            int neighbour = molecule.getNeighbour(nitrogen, i);

            if(molecule.getNeighbourBond(nitrogen, i).getOrder() == BondType.SINGLE && !molecule.isCarbon(neighbour))
                return false;
        }

        return molecule.getAtom(nitrogen).getCharge() == 0;
    }


    private static boolean hasDoubleBondedHeteroatom(Molecule molecule, int carbon)
    {
        for(int i = 0; i < molecule.getDegree(carbon); i++)
        {
            Bond bond = molecule.getNeighbourBond(carbon, i);

            if(bond.getOrder() == BondType.DOUBLE && !bond.isAromatic()
                    && !molecule.isCarbon(molecule.getNeighbour(carbon, i)))
                return true;
        }

        return false;
    }
}
