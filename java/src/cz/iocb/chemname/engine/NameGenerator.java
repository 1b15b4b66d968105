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
package cz.iocb.chemname.engine;

import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.molecule.StructuralException;
import cz.iocb.chemname.rules.NomenclatureTables;



/**
 * Entry point of the naming engine. Instances are thread-safe; every call runs its own rule fold.
 */
public class NameGenerator
{
    private final NomenclatureTables tables;
    private final RuleEngine engine;


    public NameGenerator(NomenclatureTables tables)
    {
        this.tables = tables;
        this.engine = new RuleEngine(NomenclatureRules.getRules());
    }


    /**
     * Creates a generator using the rule tables bundled with the library.
     */
    public NameGenerator()
    {
        this(NomenclatureTables.getDefault());
    }


    public NameResult generateIUPACName(Molecule molecule)
    {
        return engine.run(NamingContext.create(molecule, tables));
    }


    /**
     * @throws CDKException if the SMILES cannot be parsed
     * @throws StructuralException if the parsed molecule is malformed
     */
    public NameResult generateNameFromSmiles(String smiles) throws CDKException, StructuralException
    {
        return generateIUPACName(MoleculeCreator.getMolecule(smiles));
    }


    public NomenclatureTables getTables()
    {
        return tables;
    }
}
