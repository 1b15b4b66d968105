package cz.iocb.chemname.tool;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import org.junit.Test;
import cz.iocb.chemname.engine.NameGenerator;



public class BatchNamerTest
{
    private static final NameGenerator generator = new NameGenerator();


    @Test
    public void testProcessLines() throws Exception
    {
        StringWriter output = new StringWriter();
        BatchNamer namer = new BatchNamer(generator, false);

        int failed;

        try(PrintWriter out = new PrintWriter(output))
        {
            failed = namer.process(new BufferedReader(new StringReader("# structures\nCCO ethanol\n\nNCCN\nC1CC(\n")),
                    out);
        }

        String[] lines = output.toString().split("\\r?\\n");

        assertEquals(1, failed);
        assertEquals(3, lines.length);
        assertEquals("CCO\tethanol\t1.00\tsystematic", lines[0]);
        assertTrue(lines[1].startsWith("NCCN\tethane-1,2-diamine\t"));
        assertTrue(lines[2].endsWith("\terror"));
    }


    @Test
    public void testTrace()
    {
        StringWriter output = new StringWriter();
        boolean named;

        try(PrintWriter out = new PrintWriter(output))
        {
            named = new BatchNamer(generator, true).process("CCO.N", out);
        }

        assertFalse(named);
        assertTrue(output.toString().contains("#\t"));
    }
}
