package cz.iocb.chemname.shared;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.io.File;
import java.util.Properties;
import org.junit.Test;



public class ConfigurationPropertiesTest
{
    @Test
    public void testLoadFile() throws Exception
    {
        File file = new File(getClass().getResource("/chemname.properties").toURI());
        ConfigurationProperties properties = new ConfigurationProperties(file.getPath());

        assertEquals("structures.smi", properties.getProperty("chemname.input"));
        assertNull(properties.getProperty("chemname.output"));
        assertEquals("out.txt", properties.getProperty("chemname.output", "out.txt"));
        assertTrue(properties.getBooleanProperty("chemname.trace", false));
        assertEquals(250, properties.getIntProperty("chemname.batch", 1));
    }


    @Test
    public void testDefaults()
    {
        ConfigurationProperties properties = new ConfigurationProperties();

        assertNull(properties.getProperty("chemname.rules"));
        assertFalse(properties.getBooleanProperty("chemname.trace", false));
        assertEquals(7, properties.getIntProperty("chemname.batch", 7));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBoolean()
    {
        Properties values = new Properties();
        values.setProperty("chemname.trace", "maybe");

        new ConfigurationProperties(values).getBooleanProperty("chemname.trace", false);
    }


    @Test(expected = IllegalArgumentException.class)
    public void testInvalidInteger()
    {
        Properties values = new Properties();
        values.setProperty("chemname.batch", "many");

        new ConfigurationProperties(values).getIntProperty("chemname.batch", 0);
    }
}
