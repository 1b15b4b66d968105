package cz.iocb.chemname.rules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;



public class AliasTableTest
{
    private static AliasTable table()
    {
        Map<String, List<String>> data = new LinkedHashMap<String, List<String>>();
        data.put("2", Arrays.asList("di", "bis"));
        data.put("3", Arrays.asList("tris", "tri"));
        data.put("4", Arrays.asList("tetrakis", "tetra"));

        return new AliasTable("multipliers", data);
    }


    @Test
    public void testUnsortedAliasesAreResorted()
    {
        assertEquals(Arrays.asList("bis", "di"), table().getAliases("2"));
        assertEquals(Arrays.asList("tris", "tri"), table().getAliases("3"));
    }


    @Test
    public void testLongestMatchWins()
    {
        AliasTable table = table();

        assertEquals("tetrakis", table.match("tetrakis(methyl)", 0).getAlias());
        assertEquals("4", table.match("tetrakis(methyl)", 0).getCanonical());
        assertEquals("tri", table.match("trimethyl", 0).getAlias());
        assertNull(table.match("methyl", 0));
    }


    @Test
    public void testStripLeading()
    {
        AliasTable table = table();

        assertEquals("(methylsulfanyl)", table.stripLeading("bis(methylsulfanyl)"));
        assertEquals("methyl", table.stripLeading("methyl"));
    }


    @Test
    public void testCanonicalLookup()
    {
        Map<String, List<String>> data = new LinkedHashMap<String, List<String>>();
        data.put("acetic acid", Arrays.asList("ethanoic acid"));
        AliasTable table = new AliasTable("retained", data);

        assertEquals("acetic acid", table.getCanonical("ethanoic acid"));
        assertNull(table.getCanonical("2-chloroethanoic acid"));
        assertNull(table.getCanonical("propanoic acid"));
    }


    @Test(expected = NomenclatureTablesException.class)
    public void testDuplicateAlias()
    {
        Map<String, List<String>> data = new LinkedHashMap<String, List<String>>();
        data.put("2", Arrays.asList("di"));
        data.put("3", Arrays.asList("di"));

        new AliasTable("broken", data);
    }
}
