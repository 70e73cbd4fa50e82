/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import static java.util.Objects.requireNonNull;

/**
 * Library settings, read from the {@code ordinal.conf} resource on the class
 * path. A system property with the same name overrides the resource value.
 */
public final class Config {
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    public static final String MEMOIZE_KEY = "ordinal.recursion.memoize";
    public static final String CACHE_SIZE_KEY = "ordinal.recursion.cache-size";
    public static final String SEARCH_LIMIT_KEY = "ordinal.search.limit";

    public static final boolean DEFAULT_MEMOIZE = true;
    public static final int DEFAULT_CACHE_SIZE = 4096;
    public static final int DEFAULT_SEARCH_LIMIT = 1000000;

    private static final String DEFAULT_RESOURCE = "/ordinal.conf";

    private static final Config DEFAULT = new Config(DEFAULT_RESOURCE);

    private final ImmutableMap<String, String> conf;

    public static Config getDefault() {
        return DEFAULT;
    }

    /**
     * Load configuration from a class path resource. A missing resource
     * yields an empty configuration.
     */
    public Config(String resource) {
        this(load(requireNonNull(resource)));
    }

    public Config(Properties props) {
        this.conf = Maps.fromProperties(props);
    }

    private static Properties load(String resource) {
        Properties props = new Properties();
        try (InputStream in = Config.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.fine("Configuration resource " + resource + " not found, using defaults");
            } else {
                props.load(in);
                logger.fine("Loaded configuration from " + resource);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + resource, ex);
        }
        return props;
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return (val.isPresent() ? val : Optional.ofNullable(conf.get(name))).map(String::trim);
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        Optional<String> val = get(name);
        if (!val.isPresent())
            return deflt;
        try {
            return Integer.parseInt(val.get());
        } catch (NumberFormatException ex) {
            logger.log(Level.WARNING, "Malformed integer for " + name + ": " + val.get(), ex);
            return deflt;
        }
    }

    public boolean isMemoizing() {
        return getBoolean(MEMOIZE_KEY, DEFAULT_MEMOIZE);
    }

    /**
     * Returns a non-negative integer setting, or the default when the value
     * is malformed or negative.
     */
    public int getNonNegativeInt(String name, int deflt) {
        int val = getInt(name, deflt);
        if (val < 0) {
            logger.warning("Negative value for " + name + ": " + val + ", using " + deflt);
            return deflt;
        }
        return val;
    }

    public int getCacheSize() {
        return getNonNegativeInt(CACHE_SIZE_KEY, DEFAULT_CACHE_SIZE);
    }

    public int getSearchLimit() {
        return getNonNegativeInt(SEARCH_LIMIT_KEY, DEFAULT_SEARCH_LIMIT);
    }

    public String toString() {
        return conf.toString();
    }
}
