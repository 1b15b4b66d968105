package cz.iocb.chemname.group;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class FunctionalGroupDetectorTest
{
    private static List<GroupType> detect(String smiles) throws Exception
    {
        List<GroupType> types = new ArrayList<GroupType>();

        for(FunctionalGroup group : new FunctionalGroupDetector().detect(MoleculeCreator.getMolecule(smiles)))
            types.add(group.getType());

        return types;
    }


    @Test
    public void testSingleGroups() throws Exception
    {
        assertEquals(GroupType.ALCOHOL, detect("CCO").get(0));
        assertEquals(GroupType.CARBOXYLIC_ACID, detect("CC(=O)O").get(0));
        assertEquals(GroupType.NITRILE, detect("CC#N").get(0));
        assertEquals(GroupType.AMINE, detect("CCN").get(0));
        assertEquals(GroupType.ALDEHYDE, detect("CC=O").get(0));
        assertEquals(GroupType.KETONE, detect("CC(=O)C").get(0));
        assertEquals(GroupType.HALIDE, detect("CCCl").get(0));
    }


    @Test
    public void testSeniorityOrder() throws Exception
    {
        List<GroupType> types = detect("CCCC(=O)OC(C)(C)C(=O)NC1=CC(=C(C=C1)[N+](=O)[O-])C(F)(F)F");

        assertEquals(GroupType.ESTER, types.get(0));
        assertTrue(types.contains(GroupType.AMIDE));
        assertTrue(types.contains(GroupType.NITRO));
        assertTrue(types.indexOf(GroupType.AMIDE) < types.indexOf(GroupType.NITRO));
        assertEquals(GroupType.HALIDE, types.get(types.size() - 1));
    }


    @Test
    public void testAmideIsNotAlsoKetoneOrAmine() throws Exception
    {
        List<GroupType> types = detect("CC(=O)N");

        assertEquals(1, types.size());
        assertEquals(GroupType.AMIDE, types.get(0));
    }


    @Test
    public void testNoGroups() throws Exception
    {
        assertTrue(detect("CCCC").isEmpty());
    }


    @Test
    public void testGroupMembers() throws Exception
    {
        FunctionalGroup ester = new FunctionalGroupDetector().detect(MoleculeCreator.getMolecule("CC(=O)OC")).get(0);

        assertEquals(GroupType.ESTER, ester.getType());
        assertEquals(1, ester.getCarbon());
        assertTrue(ester.containsAtom(2));
        assertTrue(ester.containsAtom(3));
    }
}
