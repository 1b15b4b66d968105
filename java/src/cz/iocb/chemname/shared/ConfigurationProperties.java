package cz.iocb.chemname.shared;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;



public class ConfigurationProperties
{
    private final Properties properties = new Properties();


    public ConfigurationProperties()
    {
    }


    public ConfigurationProperties(String file) throws IOException
    {
        try(InputStream stream = new FileInputStream(file))
        {
            properties.load(stream);
        }
    }


    public ConfigurationProperties(Properties properties)
    {
        this.properties.putAll(properties);
    }


    public String getProperty(String key)
    {
        String value = properties.getProperty(key);
        return StringUtils.isBlank(value) ? null : value.trim();
    }


    public String getProperty(String key, String defaultValue)
    {
        String value = getProperty(key);
        return value == null ? defaultValue : value;
    }


    public int getIntProperty(String key, int defaultValue)
    {
        String value = getProperty(key);

        if(value == null)
            return defaultValue;

        try
        {
            return Integer.parseInt(value);
        }
        catch(NumberFormatException e)
        {
            throw new IllegalArgumentException("property " + key + " is not an integer: " + value, e);
        }
    }


    public boolean getBooleanProperty(String key, boolean defaultValue)
    {
        String value = getProperty(key);

        if(value == null)
            return defaultValue;

        if(value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equals("1"))
            return true;

        if(value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no") || value.equals("0"))
            return false;

        throw new IllegalArgumentException("property " + key + " is not a boolean: " + value);
    }


    public void setProperty(String key, String value)
    {
        properties.setProperty(key, value);
    }
}
