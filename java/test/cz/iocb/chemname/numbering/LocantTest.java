package cz.iocb.chemname.numbering;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;



public class LocantTest
{
    @Test
    public void testOrdering()
    {
        List<Locant> locants = new ArrayList<Locant>(Arrays.asList(Locant.of(10), Locant.of(2, 'a'), Locant.of(2),
                Locant.heteroatom("N", 1), Locant.of(1), Locant.heteroatom("N", 0)));
        Collections.sort(locants);

        assertEquals("N,N',1,2,2a,10", Locant.join(locants));
    }


    @Test
    public void testNumericComparison()
    {
        assertTrue(Locant.of(9).compareTo(Locant.of(10)) < 0);
        assertTrue(Locant.of(4, 'a').compareTo(Locant.of(4)) > 0);
        assertEquals(Locant.of(3), Locant.parse("3"));
        assertEquals(Locant.of(8, 'a'), Locant.parse("8a"));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testZeroLocant()
    {
        Locant.of(0);
    }
}
