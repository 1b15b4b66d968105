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
package cz.iocb.chemname.substituent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemname.molecule.AtomicNumbers;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.numbering.NumberingEngine;
import cz.iocb.chemname.numbering.NumberingFeatures;
import cz.iocb.chemname.parent.Branch;
import cz.iocb.chemname.parent.Chain;
import cz.iocb.chemname.parent.ChainFinder;
import cz.iocb.chemname.parent.ParentNamer;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.parent.RingParents;
import cz.iocb.chemname.parent.RingSystem;
import cz.iocb.chemname.parent.RingSystemAnalyzer;
import cz.iocb.chemname.parent.SkeletonFeatures;
import cz.iocb.chemname.rules.NomenclatureTables;
import cz.iocb.chemname.rules.NomenclatureTables.Halogen;



/**
 * Names the fragments attached to a parent structure (P-29). Every fragment is named recursively: a ring or chain
 * skeleton with a free valence and its own substituents, or one of the characteristic-group prefixes ("hydroxy",
 * "anilino", "methoxycarbonyl"). Names are memoized for the lifetime of the assembler, so an instance is bound to
 * one molecule and one naming invocation and is not thread-safe.
 */
public class SubstituentAssembler
{
    private static final Logger LOGGER = LogManager.getLogger(SubstituentAssembler.class);

    private static final Locant N_LOCANT = Locant.heteroatom("N", 0);

    private final Molecule molecule;
    private final NomenclatureTables tables;
    private final List<RingSystem> systems;
    private final ParentNamer namer;
    private final NumberingEngine engine = new NumberingEngine();
    private final Map<String, Substituent> cache = new HashMap<String, Substituent>();


    private static class Candidate
    {
        private final ParentStructure parent;
        private final NumberingFeatures features;
        private final List<Substituent> substituents;


        Candidate(ParentStructure parent, NumberingFeatures features, List<Substituent> substituents)
        {
            this.parent = parent;
            this.features = features;
            this.substituents = substituents;
        }
    }


    public SubstituentAssembler(Molecule molecule, NomenclatureTables tables, List<RingSystem> systems)
    {
        this.molecule = molecule;
        this.tables = tables;
        this.systems = systems;
        this.namer = new ParentNamer(molecule, tables);
    }


    /**
     * Names the fragment starting at the root of the branch. The fragment consists of the atoms reachable from the
     * root without passing the attachment atom or any excluded atom.
     */
    public Substituent name(Branch branch, Set<Integer> excluded)
    {
        String key = branch.getAttachment() + ">" + branch.getRoot() + new TreeSet<Integer>(excluded);
        Substituent substituent = cache.get(key);

        if(substituent == null)
        {
            Set<Integer> blocked = new HashSet<Integer>(excluded);
            blocked.add(branch.getAttachment());

            substituent = build(branch.getAttachment(), branch.getRoot(), branch.getOrder(), blocked);
            cache.put(key, substituent);

            LOGGER.trace("fragment {} named {}", branch, substituent.getName());
        }

        return substituent;
    }


    private Substituent build(int attachment, int root, int order, Set<Integer> blocked)
    {
        if(molecule.isRingAtom(root))
            return ring(attachment, root, order, blocked);

        switch(molecule.getAtomicNumber(root))
        {
            case AtomicNumbers.C:
                return carbon(attachment, root, order, blocked);

            case AtomicNumbers.N:
                return nitrogen(attachment, root, order, blocked);

            case AtomicNumbers.O:
                return oxygen(attachment, root, order, blocked);

            case AtomicNumbers.S:
                return sulfur(attachment, root, order, blocked);

            default:
                Halogen halogen = tables.getHalogen(molecule.getSymbol(root));

                if(halogen != null && order == Molecule.BondType.SINGLE)
                    return Substituent.simple(attachment, halogen.getPrefix());

                return unrecognized(attachment, root);
        }
    }


    private Substituent ring(int attachment, int root, int order, Set<Integer> blocked)
    {
        RingSystem system = RingSystemAnalyzer.findSystem(systems, root);
        ParentStructure parent = RingParents.create(molecule, system, tables);

        return skeletal(Collections.singletonList(parent), attachment, root, freeValence(order), false, blocked,
                false);
    }


    private Substituent carbon(int attachment, int root, int order, Set<Integer> blocked)
    {
        List<Integer> others = others(root, blocked);

        if(order == Molecule.BondType.SINGLE && others.size() == 1 && isNitrileNitrogen(root, others.get(0)))
            return Substituent.simple(attachment, "cyano");

        int oxo = doubleBondedOxygen(root, blocked);

        if(order == Molecule.BondType.SINGLE && oxo >= 0)
        {
            others.remove(Integer.valueOf(oxo));

            if(others.isEmpty())
                return new Substituent(attachment, "", "formyl", false, true, true, false);

            int other = others.get(0);
            Set<Integer> inner = new HashSet<Integer>(blocked);
            inner.add(root);
            inner.add(oxo);

            switch(molecule.getAtomicNumber(other))
            {
                case AtomicNumbers.O:
                {
                    if(molecule.isRingAtom(other))
                        break;

                    List<Integer> rest = others(other, inner);

                    if(rest.isEmpty())
                        return Substituent.simple(attachment,
                                molecule.getAtom(other).getCharge() < 0 ? "carboxylato" : "carboxy");

                    inner.add(other);
                    Substituent alkyl = name(new Branch(other, rest.get(0), Molecule.BondType.SINGLE), inner);
                    Substituent alkoxy = oxy(attachment, alkyl);

                    return new Substituent(attachment, "", alkoxy.getName() + "carbonyl", true, false,
                            alkyl.isRecognized(), alkyl.isApproximate());
                }

                case AtomicNumbers.N:
                {
                    if(molecule.isRingAtom(other))
                        break;

                    inner.add(other);
                    List<Substituent> nitrogenSubstituents = nameNeighbours(other, inner);

                    if(nitrogenSubstituents.isEmpty())
                        return Substituent.simple(attachment, "carbamoyl");

                    return new Substituent(attachment, "", renderUnlocated(nitrogenSubstituents) + "carbamoyl", true,
                            false, isRecognized(nitrogenSubstituents), isApproximate(nitrogenSubstituents));
                }

                case AtomicNumbers.C:
                {
                    if(molecule.isRingAtom(other))
                    {
                        RingSystem system = RingSystemAnalyzer.findSystem(systems, other);
                        ParentStructure parent = RingParents.create(molecule, system, tables);
                        return skeletal(Collections.singletonList(parent), attachment, other, "carbonyl", false,
                                inner, true);
                    }

                    Set<Integer> chainBlocked = new HashSet<Integer>(blocked);
                    chainBlocked.add(oxo);
                    return skeletal(chains(root, chainBlocked), attachment, root, "oyl", true, chainBlocked, true);
                }

                default:
                {
                    Halogen halogen = tables.getHalogen(molecule.getSymbol(other));

                    if(halogen != null)
                    {
                        String anion = halogen.getAnion();
                        return Substituent.simple(attachment, "carbono" + anion.substring(0, anion.length() - 1)
                                + "oyl");
                    }
                }
            }
        }

        return skeletal(chains(root, blocked), attachment, root, freeValence(order), false, blocked, false);
    }


    private Substituent nitrogen(int attachment, int root, int order, Set<Integer> blocked)
    {
        List<Integer> others = others(root, blocked);
        int oxygens = 0;

        for(int other : others)
            if(molecule.getAtomicNumber(other) == AtomicNumbers.O && molecule.getDegree(other) == 1)
                oxygens++;

        if(order == Molecule.BondType.SINGLE && others.size() == 2 && oxygens == 2)
            return Substituent.simple(attachment, "nitro");

        if(order == Molecule.BondType.SINGLE && others.size() == 1 && oxygens == 1
                && molecule.getBond(root, others.get(0)).getOrder() == Molecule.BondType.DOUBLE)
            return Substituent.simple(attachment, "nitroso");

        if(order == Molecule.BondType.TRIPLE)
            return Substituent.simple(attachment, "nitrilo");

        String ending = order == Molecule.BondType.DOUBLE ? "imino" : "amino";

        if(others.isEmpty())
            return Substituent.simple(attachment, ending);

        Set<Integer> inner = new HashSet<Integer>(blocked);
        inner.add(root);
        List<Substituent> substituents = nameNeighbours(root, inner);

        if(order == Molecule.BondType.SINGLE && substituents.size() == 1)
        {
            Substituent substituent = substituents.get(0);

            if(substituent.getStem().equals("phenyl") && molecule.getBond(root, others.get(0)).getOrder() == 1)
                return new Substituent(attachment, substituent.getPrefixes(), "anilino", substituent.isCompound(),
                        false, substituent.isRecognized(), substituent.isApproximate());

            if(substituent.isAcyl())
                return new Substituent(attachment, substituent.getPrefixes(), amido(substituent.getStem()),
                        substituent.isCompound(), false, substituent.isRecognized(), substituent.isApproximate());
        }

        return new Substituent(attachment, "", renderUnlocated(substituents) + ending, true, false,
                isRecognized(substituents), isApproximate(substituents));
    }


    private Substituent oxygen(int attachment, int root, int order, Set<Integer> blocked)
    {
        if(order == Molecule.BondType.DOUBLE)
            return Substituent.simple(attachment, "oxo");

        List<Integer> others = others(root, blocked);

        if(others.isEmpty())
            return Substituent.simple(attachment, molecule.getAtom(root).getCharge() < 0 ? "oxido" : "hydroxy");

        int other = others.get(0);
        Set<Integer> inner = new HashSet<Integer>(blocked);
        inner.add(root);

        if(molecule.getAtomicNumber(other) == AtomicNumbers.O && !molecule.isRingAtom(other))
        {
            List<Integer> rest = others(other, inner);

            if(rest.isEmpty())
                return Substituent.simple(attachment, "hydroperoxy");

            inner.add(other);
            Substituent alkyl = name(new Branch(other, rest.get(0), Molecule.BondType.SINGLE), inner);

            return new Substituent(attachment, "", Prefixes.enclosed(alkyl.getName(), alkyl.isCompound()) + "peroxy",
                    true, false, alkyl.isRecognized(), alkyl.isApproximate());
        }

        return oxy(attachment, name(new Branch(root, other, Molecule.BondType.SINGLE), inner));
    }


    private Substituent sulfur(int attachment, int root, int order, Set<Integer> blocked)
    {
        if(order == Molecule.BondType.DOUBLE)
            return Substituent.simple(attachment, "sulfanylidene");

        List<Integer> others = others(root, blocked);
        int oxo = 0;

        for(int other : new ArrayList<Integer>(others))
        {
            if(molecule.getAtomicNumber(other) == AtomicNumbers.O && molecule.getDegree(other) == 1
                    && molecule.getBond(root, other).getOrder() == Molecule.BondType.DOUBLE)
            {
                others.remove(Integer.valueOf(other));
                oxo++;
            }
        }

        String kind = oxo == 0 ? "sulfanyl" : oxo == 1 ? "sulfinyl" : "sulfonyl";

        if(others.isEmpty())
            return Substituent.simple(attachment, kind);

        if(others.size() > 1 || oxo > 2)
            return unrecognized(attachment, root);

        int other = others.get(0);

        if(oxo == 2 && molecule.getAtomicNumber(other) == AtomicNumbers.O && molecule.getDegree(other) == 1)
            return Substituent.simple(attachment, "sulfo");

        if(oxo == 2 && molecule.getAtomicNumber(other) == AtomicNumbers.N && molecule.getDegree(other) == 1)
            return Substituent.simple(attachment, "sulfamoyl");

        Set<Integer> inner = new HashSet<Integer>(blocked);
        inner.add(root);
        Substituent substituent = name(new Branch(root, other, molecule.getBond(root, other).getOrder()), inner);

        return new Substituent(attachment, "", Prefixes.enclosed(substituent.getName(), substituent.isCompound()) + kind,
                true, false, substituent.isRecognized(), substituent.isApproximate());
    }


    private Substituent unrecognized(int attachment, int root)
    {
        LOGGER.debug("no prefix known for fragment rooted at {}", molecule.getAtom(root));

        return new Substituent(attachment, "", "unknown", false, false, false, false);
    }


    /**
     * Expresses an ether oxygen substituted by the given group, using the contracted alkoxy names where they exist.
     */
    private Substituent oxy(int attachment, Substituent alkyl)
    {
        String contracted = tables.getAlkoxyName(alkyl.getStem());

        if(contracted != null)
            return new Substituent(attachment, alkyl.getPrefixes(), contracted, alkyl.isCompound(), false,
                    alkyl.isRecognized(), alkyl.isApproximate());

        return new Substituent(attachment, "", Prefixes.enclosed(alkyl.getName(), alkyl.isCompound()) + "oxy", true,
                false, alkyl.isRecognized(), alkyl.isApproximate());
    }


    private static String amido(String acyl)
    {
        if(acyl.endsWith("carbonyl"))
            return acyl.substring(0, acyl.length() - "carbonyl".length()) + "carboxamido";

        if(acyl.endsWith("oyl"))
            return acyl.substring(0, acyl.length() - "oyl".length()) + "amido";

        return acyl.substring(0, acyl.length() - "yl".length()) + "amido";
    }


    /**
     * Names the skeleton that gives the best substituent name: the longest chain, then the most multiple bonds, then
     * the lowest locants for the free valence, multiple bonds and prefixes.
     *
     * @param anchor skeletal atom carrying the free valence or the acyl suffix
     */
    private Substituent skeletal(List<ParentStructure> candidates, int attachment, int anchor, String suffixText,
            boolean terminal, Set<Integer> blocked, boolean acyl)
    {
        Candidate best = null;

        for(ParentStructure parent : candidates)
        {
            Set<Integer> inner = new HashSet<Integer>(blocked);
            inner.addAll(parent.getAtomSet());

            NumberingFeatures features = SkeletonFeatures.collect(molecule, parent, tables);
            features.addPrincipalAtom(anchor);

            List<Substituent> substituents = new ArrayList<Substituent>();

            for(Branch branch : Branch.find(molecule, parent.getAtomSet(), blocked))
            {
                Substituent substituent = name(branch, inner);
                substituents.add(substituent);
                features.addSubstituent(branch.getAttachment(), Prefixes.key(substituent.getName()),
                        substituent.getName());
            }

            Numbering numbering = engine.choose(parent.getCandidateNumberings(), features).getNumbering();
            Candidate candidate = new Candidate(parent.withNumbering(numbering), features, substituents);

            if(best == null || compare(candidate, best) < 0)
                best = candidate;
        }

        Numbering numbering = best.parent.getNumbering();
        List<Substituent> located = new ArrayList<Substituent>();

        for(Substituent substituent : best.substituents)
            located.add(substituent.withLocant(numbering.getLocant(substituent.getAttachment())));

        ParentNamer.Suffix suffix = new ParentNamer.Suffix(suffixText,
                Collections.singletonList(numbering.getLocant(anchor)), terminal);

        String stem = namer.name(best.parent, suffix, located.size());

        if(acyl)
        {
            String retained = tables.getAcylName(namer.name(best.parent, suffix, 0));

            if(retained != null)
                stem = retained;
        }

        String prefixes = Prefixes.render(Prefixes.merge(located, tables),
                namer.omitPrefixLocants(best.parent, suffix, located.size()), tables);

        if(!prefixes.isEmpty() && Character.isDigit(stem.charAt(0)))
            prefixes += "-";

        return new Substituent(attachment, prefixes, stem, !located.isEmpty(), acyl, isRecognized(located),
                isApproximate(located) || namer.isApproximate(best.parent));
    }


    private int compare(Candidate a, Candidate b)
    {
        if(a.parent.getSize() != b.parent.getSize())
            return Integer.compare(b.parent.getSize(), a.parent.getSize());

        if(a.features.getMultipleBondCount() != b.features.getMultipleBondCount())
            return Integer.compare(b.features.getMultipleBondCount(), a.features.getMultipleBondCount());

        if(a.features.getDoubleBondCount() != b.features.getDoubleBondCount())
            return Integer.compare(b.features.getDoubleBondCount(), a.features.getDoubleBondCount());

        for(int criterion = 3; criterion <= 5; criterion++)
        {
            int result = compareVectors(a, b, criterion);

            if(result != 0)
                return result;
        }

        if(a.features.getSubstituentCount() != b.features.getSubstituentCount())
            return Integer.compare(b.features.getSubstituentCount(), a.features.getSubstituentCount());

        for(int criterion = 6; criterion < NumberingEngine.CRITERIA; criterion++)
        {
            int result = compareVectors(a, b, criterion);

            if(result != 0)
                return result;
        }

        int[] atomsA = a.parent.getAtoms();
        int[] atomsB = b.parent.getAtoms();
        Arrays.sort(atomsA);
        Arrays.sort(atomsB);

        for(int i = 0; i < Math.min(atomsA.length, atomsB.length); i++)
            if(atomsA[i] != atomsB[i])
                return Integer.compare(atomsA[i], atomsB[i]);

        return 0;
    }


    private static int compareVectors(Candidate a, Candidate b, int criterion)
    {
        return NumberingEngine.compareVectors(
                NumberingEngine.vector(a.parent.getNumbering(), a.features, criterion),
                NumberingEngine.vector(b.parent.getNumbering(), b.features, criterion));
    }


    /**
     * @return all chains through the root built of acyclic carbon atoms; carboxy and cyano carbon atoms are left out
     */
    private List<ParentStructure> chains(int root, Set<Integer> blocked)
    {
        boolean[] eligible = new boolean[molecule.getAtomCount()];

        for(int atom = 0; atom < eligible.length; atom++)
            eligible[atom] = molecule.isCarbon(atom) && !molecule.isRingAtom(atom) && !blocked.contains(atom)
                    && !isCarboxyCarbon(atom) && !isNitrileCarbon(atom);

        eligible[root] = true;

        List<ParentStructure> chains = new ArrayList<ParentStructure>();

        for(int[] path : new ChainFinder(molecule, eligible).findChainsThrough(root))
            chains.add(new Chain(path));

        return chains;
    }


    private List<Substituent> nameNeighbours(int atom, Set<Integer> inner)
    {
        List<Substituent> substituents = new ArrayList<Substituent>();

        for(int i = 0; i < molecule.getDegree(atom); i++)
        {
            int neighbour = molecule.getNeighbour(atom, i);

            if(inner.contains(neighbour))
                continue;

            Branch branch = new Branch(atom, neighbour, molecule.getNeighbourBond(atom, i).getOrder());
            substituents.add(name(branch, inner).withLocant(N_LOCANT));
        }

        return substituents;
    }


    private String renderUnlocated(List<Substituent> substituents)
    {
        return Prefixes.render(Prefixes.merge(substituents, tables), true, tables);
    }


    private List<Integer> others(int atom, Set<Integer> blocked)
    {
        List<Integer> others = new ArrayList<Integer>();

        for(int neighbour : molecule.getNeighbours(atom))
            if(!blocked.contains(neighbour))
                others.add(neighbour);

        return others;
    }


    private int doubleBondedOxygen(int atom, Set<Integer> blocked)
    {
        for(int i = 0; i < molecule.getDegree(atom); i++)
        {
            int neighbour = molecule.getNeighbour(atom, i);
            Bond bond = molecule.getNeighbourBond(atom, i);

            if(!blocked.contains(neighbour) && molecule.getAtomicNumber(neighbour) == AtomicNumbers.O
                    && bond.getOrder() == Molecule.BondType.DOUBLE && molecule.getDegree(neighbour) == 1)
                return neighbour;
        }

        return -1;
    }


    private boolean isNitrileNitrogen(int carbon, int nitrogen)
    {
        return molecule.getAtomicNumber(nitrogen) == AtomicNumbers.N && molecule.getDegree(nitrogen) == 1
                && molecule.getBond(carbon, nitrogen).getOrder() == Molecule.BondType.TRIPLE;
    }


    private boolean isNitrileCarbon(int atom)
    {
        for(int neighbour : molecule.getNeighbours(atom))
            if(isNitrileNitrogen(atom, neighbour))
                return true;

        return false;
    }


    private boolean isCarboxyCarbon(int atom)
    {
        if(doubleBondedOxygen(atom, Collections.<Integer> emptySet()) < 0)
            return false;

        for(int i = 0; i < molecule.getDegree(atom); i++)
        {
            int neighbour = molecule.getNeighbour(atom, i);

            if(molecule.getAtomicNumber(neighbour) == AtomicNumbers.O && molecule.getDegree(neighbour) == 1
                    && molecule.getNeighbourBond(atom, i).getOrder() == Molecule.BondType.SINGLE)
                return true;
        }

        return false;
    }


    private static String freeValence(int order)
    {
        return order == Molecule.BondType.TRIPLE ? "ylidyne" : order == Molecule.BondType.DOUBLE ? "ylidene" : "yl";
    }


    private static boolean isRecognized(List<Substituent> substituents)
    {
        for(Substituent substituent : substituents)
            if(!substituent.isRecognized())
                return false;

        return true;
    }


    private static boolean isApproximate(List<Substituent> substituents)
    {
        for(Substituent substituent : substituents)
            if(substituent.isApproximate())
                return true;

        return false;
    }
}
