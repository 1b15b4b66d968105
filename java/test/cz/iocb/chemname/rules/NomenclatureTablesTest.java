package cz.iocb.chemname.rules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import cz.iocb.chemname.group.GroupType;



public class NomenclatureTablesTest
{
    private final NomenclatureTables tables = NomenclatureTables.getDefault();


    @Test
    public void testDefaultTablesAreShared()
    {
        assertSame(tables, NomenclatureTables.getDefault());
    }


    @Test
    public void testMultipliers()
    {
        assertEquals("", tables.getBasicMultiplier(1));
        assertEquals("di", tables.getBasicMultiplier(2));
        assertEquals("bis", tables.getGroupMultiplier(2));
        assertEquals("tetrakis", tables.getGroupMultiplier(4));
        assertEquals("bi", tables.getCycleMultiplier(2));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testMissingMultiplier()
    {
        tables.getBasicMultiplier(1000);
    }


    @Test
    public void testStems()
    {
        assertEquals("meth", tables.getAlkaneStem(1));
        assertEquals("but", tables.getAlkaneStem(4));
        assertNotNull(tables.getHantzschWidmanStem(5, null));
    }


    @Test
    public void testHeteroatomSeniority()
    {
        assertTrue(tables.getHeteroatomSeniority("O") < tables.getHeteroatomSeniority("S"));
        assertTrue(tables.getHeteroatomSeniority("S") < tables.getHeteroatomSeniority("N"));
        assertEquals(Integer.MAX_VALUE, tables.getHeteroatomSeniority("C"));
        assertEquals("aza", tables.getHeteroatom("N").getPrefix());
    }


    @Test
    public void testRetainedNames()
    {
        assertEquals("acetic acid", tables.getRetainedNames().getCanonical("ethanoic acid"));
        assertEquals("acetyl", tables.getAcylName("ethanoyl"));
        assertEquals("methoxy", tables.getAlkoxyName("methyl"));
        assertNull(tables.getAlkoxyName("octyl"));
        assertEquals("chloro", tables.getHalogen("Cl").getPrefix());
    }


    @Test
    public void testGroupNames()
    {
        assertEquals("ol", tables.getGroupNames(GroupType.ALCOHOL).getSuffix(false, false));
        assertEquals("hydroxy", tables.getGroupNames(GroupType.ALCOHOL).getPrefix());
    }


    @Test
    public void testRingTemplates()
    {
        assertTrue(tables.getRingTemplates().size() > 5);
        assertEquals("benzene", tables.getRingTemplates().get(0).getName());
    }
}
