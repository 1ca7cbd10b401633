/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.log4j.Logger;

/**
    Process-wide settings. Values come from the resource cas.properties next to this class,
    and any JVM system property with the same key overrides the file.
**/
public class AppData
{
    public static final Properties properties = new Properties ();

    private static Logger logger = Logger.getLogger (AppData.class);

    static
    {
        try (InputStream stream = AppData.class.getResourceAsStream ("cas.properties"))
        {
            if (stream == null) logger.warn ("cas.properties not found on classpath; using built-in defaults");
            else                properties.load (stream);
        }
        catch (IOException e)
        {
            throw new ExceptionInInitializerError (e);
        }
    }

    public static String get (String key, String defaultValue)
    {
        String value = System.getProperty (key);
        if (value != null) return value;
        return properties.getProperty (key, defaultValue);
    }

    public static int getInt (String key, int defaultValue)
    {
        String value = get (key, null);
        if (value == null) return defaultValue;
        try
        {
            return Integer.parseInt (value.trim ());
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Setting " + key + "=" + value + " is not an integer; using " + defaultValue);
            return defaultValue;
        }
    }
}
