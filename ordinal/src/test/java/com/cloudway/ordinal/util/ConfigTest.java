/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.util;

import java.util.Properties;

import org.junit.After;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ConfigTest
{
    @After
    public void clearOverrides() {
        System.clearProperty(Config.SEARCH_LIMIT_KEY);
        System.clearProperty(Config.MEMOIZE_KEY);
    }

    private static Config config(String... pairs) {
        Properties props = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            props.setProperty(pairs[i], pairs[i + 1]);
        }
        return new Config(props);
    }

    @Test
    public void defaults() {
        Config conf = config();
        assertThat(conf.isMemoizing(), is(Config.DEFAULT_MEMOIZE));
        assertThat(conf.getCacheSize(), is(Config.DEFAULT_CACHE_SIZE));
        assertThat(conf.getSearchLimit(), is(Config.DEFAULT_SEARCH_LIMIT));
        assertThat(conf.get("no.such.key").isPresent(), is(false));
        assertThat(conf.get("no.such.key", "x"), is("x"));
    }

    @Test
    public void classpathResource() {
        Config conf = Config.getDefault();
        assertThat(conf.isMemoizing(), is(true));
        assertThat(conf.getCacheSize(), is(4096));
        assertThat(conf.get(Config.SEARCH_LIMIT_KEY).get(), is("1000000"));
    }

    @Test
    public void missingResource() {
        Config conf = new Config("/no-such-ordinal.conf");
        assertThat(conf.getCacheSize(), is(Config.DEFAULT_CACHE_SIZE));
    }

    @Test
    public void properties() {
        Config conf = config(Config.MEMOIZE_KEY, "false",
                             Config.CACHE_SIZE_KEY, " 12 ",
                             Config.SEARCH_LIMIT_KEY, "500");
        assertThat(conf.isMemoizing(), is(false));
        assertThat(conf.getCacheSize(), is(12));
        assertThat(conf.getSearchLimit(), is(500));
    }

    @Test
    public void systemPropertyOverrides() {
        Config conf = config(Config.SEARCH_LIMIT_KEY, "500", Config.MEMOIZE_KEY, "true");
        System.setProperty(Config.SEARCH_LIMIT_KEY, "17");
        System.setProperty(Config.MEMOIZE_KEY, "false");
        assertThat(conf.getSearchLimit(), is(17));
        assertThat(conf.isMemoizing(), is(false));
    }

    @Test
    public void systemPropertyIsTrimmed() {
        System.setProperty(Config.SEARCH_LIMIT_KEY, " 17 ");
        assertThat(config().getSearchLimit(), is(17));
    }

    @Test
    public void negativeSizes() {
        Config conf = config(Config.CACHE_SIZE_KEY, "-1", Config.SEARCH_LIMIT_KEY, "-5");
        assertThat(conf.getCacheSize(), is(Config.DEFAULT_CACHE_SIZE));
        assertThat(conf.getSearchLimit(), is(Config.DEFAULT_SEARCH_LIMIT));
        assertThat(conf.getNonNegativeInt("no.such.key", 3), is(3));
    }

    @Test
    public void malformedInteger() {
        Config conf = config(Config.CACHE_SIZE_KEY, "lots");
        assertThat(conf.getCacheSize(), is(Config.DEFAULT_CACHE_SIZE));
    }
}
