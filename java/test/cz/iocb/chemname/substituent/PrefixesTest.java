package cz.iocb.chemname.substituent;

import static org.junit.Assert.assertEquals;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.rules.NomenclatureTables;



public class PrefixesTest
{
    private final NomenclatureTables tables = NomenclatureTables.getDefault();


    private static Substituent at(String name, int locant)
    {
        return Substituent.simple(0, name).withLocant(Locant.of(locant));
    }


    private static Substituent compoundAt(String name, int locant)
    {
        return new Substituent(0, "", name, true, false, true, false).withLocant(Locant.of(locant));
    }


    @Test
    public void testMultipliedPrefixes()
    {
        List<Substituent> substituents = new ArrayList<Substituent>();
        substituents.add(at("methyl", 3));
        substituents.add(at("chloro", 4));
        substituents.add(at("methyl", 2));

        assertEquals("4-chloro-2,3-dimethyl", Prefixes.render(Prefixes.merge(substituents, tables), false, tables));
    }


    @Test
    public void testMultiplierIgnoredInOrder()
    {
        List<Substituent> substituents = new ArrayList<Substituent>();
        substituents.add(at("methyl", 6));
        substituents.add(compoundAt("methylsulfanyl", 3));
        substituents.add(compoundAt("methylsulfanyl", 5));

        assertEquals("6-methyl-3,5-bis(methylsulfanyl)",
                Prefixes.render(Prefixes.merge(substituents, tables), false, tables));
    }


    @Test
    public void testOmittedLocants()
    {
        List<Substituent> substituents = new ArrayList<Substituent>();
        substituents.add(at("chloro", 1));

        assertEquals("chloro", Prefixes.render(Prefixes.merge(substituents, tables), true, tables));
    }


    @Test
    public void testEnclosure()
    {
        assertEquals("(methyl)", Prefixes.enclose("methyl"));
        assertEquals("[2-(trifluoromethyl)phenyl]", Prefixes.enclose("2-(trifluoromethyl)phenyl"));
        assertEquals("{2-[3-(chloro)propyl]phenyl}", Prefixes.enclose("2-[3-(chloro)propyl]phenyl"));
    }


    @Test
    public void testPrepend()
    {
        assertEquals("chlorobenzene", Prefixes.prepend("chloro", "benzene"));
        assertEquals("6-methyl-2H-pyran", Prefixes.prepend("6-methyl", "2H-pyran"));
        assertEquals("benzene", Prefixes.prepend("", "benzene"));
    }


    @Test
    public void testKey()
    {
        assertEquals("methylsulfanyl", Prefixes.key("(methylsulfanyl)"));
        assertEquals("trifluoromethyl", Prefixes.key("3-(Trifluoromethyl)"));
    }
}
