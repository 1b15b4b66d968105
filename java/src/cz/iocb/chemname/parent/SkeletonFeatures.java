package cz.iocb.chemname.parent;

import cz.iocb.chemname.molecule.AtomicNumbers;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.NumberingFeatures;
import cz.iocb.chemname.rules.NomenclatureTables;



/**
 * Collects the numbering features that depend only on the skeleton: heteroatoms, indicated hydrogen and multiple
 * bonds not implied by the skeleton name.
 */
public class SkeletonFeatures
{
    public static NumberingFeatures collect(Molecule molecule, ParentStructure parent, NomenclatureTables tables)
    {
        NumberingFeatures features = new NumberingFeatures();

        for(int atom : parent.getAtoms())
        {
            if(!molecule.isCarbon(atom))
                features.addHeteroatom(atom, tables.getHeteroatomSeniority(molecule.getSymbol(atom)));

            if(parent.isMancude() && hasIndicatedHydrogen(molecule, atom))
                features.addIndicatedHydrogen(atom);
        }

        if(!parent.isMancude())
        {
            for(int atom : parent.getAtoms())
            {
                for(int i = 0; i < molecule.getDegree(atom); i++)
                {
                    int neighbour = molecule.getNeighbour(atom, i);
                    Bond bond = molecule.getNeighbourBond(atom, i);

                    if(atom < neighbour && parent.contains(neighbour) && bond.getOrder() > Molecule.BondType.SINGLE)
                        features.addMultipleBond(atom, neighbour, bond.getOrder() == Molecule.BondType.DOUBLE);
                }
            }
        }

        return features;
    }


    /**
     * @return whether the atom of a mancude ring carries the extra hydrogen cited as "1H" (pyrrole-type nitrogen)
     */
    public static boolean hasIndicatedHydrogen(Molecule molecule, int atom)
    {
        if(molecule.getAtomicNumber(atom) != AtomicNumbers.N || !molecule.getAtom(atom).isAromatic()
                || molecule.getAtom(atom).getCharge() != 0)
            return false;

        return molecule.getAtom(atom).getHydrogenCount() + molecule.getDegree(atom) == 3;
    }
}
