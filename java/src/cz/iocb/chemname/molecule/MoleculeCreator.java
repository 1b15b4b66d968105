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

import java.util.HashMap;
import java.util.Map;
import org.openscience.cdk.aromaticity.Aromaticity;
import org.openscience.cdk.aromaticity.ElectronDonation;
import org.openscience.cdk.atomtype.CDKAtomTypeMatcher;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.graph.Cycles;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IAtomType;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IDoubleBondStereochemistry;
import org.openscience.cdk.interfaces.IDoubleBondStereochemistry.Conformation;
import org.openscience.cdk.interfaces.IStereoElement;
import org.openscience.cdk.silent.SilentChemObjectBuilder;
import org.openscience.cdk.smiles.SmilesParser;
import org.openscience.cdk.tools.CDKHydrogenAdder;
import org.openscience.cdk.tools.manipulator.AtomContainerManipulator;
import org.openscience.cdk.tools.manipulator.AtomTypeManipulator;



/**
 * Class for creating molecules
 */
public class MoleculeCreator
{
    private static final ThreadLocal<Aromaticity> aromaticity = new ThreadLocal<Aromaticity>()
    {
        @Override
        protected Aromaticity initialValue()
        {
            return new Aromaticity(ElectronDonation.daylight(), Cycles.or(Cycles.all(), Cycles.all(6)));
        }
    };


    private static final ThreadLocal<SmilesParser> smilesParser = new ThreadLocal<SmilesParser>()
    {
        @Override
        protected SmilesParser initialValue()
        {
            return new SmilesParser(SilentChemObjectBuilder.getInstance());
        }
    };


    public static IAtomContainer getMoleculeFromSmiles(String smiles) throws CDKException
    {
        IAtomContainer molecule = smilesParser.get().parseSmiles(smiles);
        return molecule;
    }


    public static Molecule getMolecule(String smiles) throws CDKException, StructuralException
    {
        return translateMolecule(getMoleculeFromSmiles(smiles));
    }


    /**
     * Suppresses hydrogens, perceives aromaticity and the SSSR, and converts the container to the immutable model.
     *
     * @param container molecule with Kekule bond orders
     * @return immutable molecule
     * @throws CDKException
     * @throws StructuralException
     */
    public static Molecule translateMolecule(IAtomContainer container) throws CDKException, StructuralException
    {
        IAtomContainer molecule = AtomContainerManipulator.suppressHydrogens(container);

        configureHydrogens(molecule);
        configureAromaticity(molecule);


        MoleculeBuilder builder = new MoleculeBuilder();

        for(IAtom atom : molecule.atoms())
        {
            int charge = atom.getFormalCharge() == null ? 0 : atom.getFormalCharge();
            int isotope = atom.getMassNumber() == null ? 0 : atom.getMassNumber();
            int hydrogens = atom.getImplicitHydrogenCount() == null ? 0 : atom.getImplicitHydrogenCount();

            builder.addAtom(atom.getSymbol(), charge, atom.isAromatic(), isotope, hydrogens);
        }


        Map<IBond, IDoubleBondStereochemistry> stereo = new HashMap<IBond, IDoubleBondStereochemistry>();

        for(IStereoElement<?, ?> element : molecule.stereoElements())
            if(element instanceof IDoubleBondStereochemistry)
                stereo.put(((IDoubleBondStereochemistry) element).getStereoBond(),
                        (IDoubleBondStereochemistry) element);

        for(IBond bond : molecule.bonds())
        {
            int a = molecule.indexOf(bond.getBegin());
            int b = molecule.indexOf(bond.getEnd());
            IDoubleBondStereochemistry element = stereo.get(bond);

            byte marker = Molecule.BondStereo.NONE;
            int ligand1 = -1;
            int ligand2 = -1;

            if(element != null && element.getStereo() != null)
            {
                marker = element.getStereo() == Conformation.OPPOSITE ? Molecule.BondStereo.OPPOSITE
                        : Molecule.BondStereo.TOGETHER;

                for(IBond ligand : element.getBonds())
                {
                    if(ligand.contains(bond.getBegin()))
                        ligand1 = molecule.indexOf(ligand.getOther(bond.getBegin()));
                    else if(ligand.contains(bond.getEnd()))
                        ligand2 = molecule.indexOf(ligand.getOther(bond.getEnd()));
                }

                if(ligand1 < 0 || ligand2 < 0)
                    marker = Molecule.BondStereo.UNDEFINED;
            }

            builder.addBond(a, b, getBondOrder(bond), bond.isAromatic(), marker, ligand1, ligand2);
        }


        for(int[] path : Cycles.sssr(molecule).paths())
        {
            int[] ring = new int[path.length - 1];
            System.arraycopy(path, 0, ring, 0, ring.length);
            builder.addRing(ring);
        }

        return builder.build();
    }


    private static byte getBondOrder(IBond bond)
    {
        if(bond.getOrder() == null)
            return Molecule.BondType.SINGLE;

        switch(bond.getOrder())
        {
            case SINGLE:
                return Molecule.BondType.SINGLE;
            case DOUBLE:
                return Molecule.BondType.DOUBLE;
            case TRIPLE:
                return Molecule.BondType.TRIPLE;
            default:
                return Molecule.BondType.SINGLE;
        }
    }


    private static void configureHydrogens(IAtomContainer molecule) throws CDKException
    {
        CDKAtomTypeMatcher matcher = null;

        for(IAtom atom : molecule.atoms())
        {
            if(atom.getImplicitHydrogenCount() == null)
            {
                if(matcher == null)
                    matcher = CDKAtomTypeMatcher.getInstance(molecule.getBuilder());

                IAtomType type = matcher.findMatchingAtomType(molecule, atom);

                if(type == null)
                {
                    atom.setImplicitHydrogenCount(0);
                    continue;
                }

                AtomTypeManipulator.configure(atom, type);
                CDKHydrogenAdder adder = CDKHydrogenAdder.getInstance(molecule.getBuilder());
                adder.addImplicitHydrogens(molecule, atom);
            }
        }
    }


    public static void configureAromaticity(IAtomContainer molecule) throws CDKException
    {
        for(IAtom atom : molecule.atoms())
            atom.setIsAromatic(false);

        for(IBond bond : molecule.bonds())
            bond.setIsAromatic(false);

        aromaticity.get().apply(molecule);
    }
}
