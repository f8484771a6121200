/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;

import com.cloudway.trie.KeyWidth;

/**
 * Configuration of the trie library. A setting is looked up first in the JVM
 * system properties, then in the environment (for settings that have an
 * environment name), then in the {@code trie.properties} classpath resource.
 */
public class TrieConfig
{
    private static final Logger logger = Logger.getLogger(TrieConfig.class.getName());

    public static final String KEY_WIDTH_KEY = "cloudway.trie.keyWidth";
    public static final String KEY_WIDTH_ENV = "CLOUDWAY_TRIE_KEY_WIDTH";
    public static final String RESOURCE_NAME = "trie.properties";

    private static final Supplier<TrieConfig> DEFAULT =
        Suppliers.memoize(() -> new TrieConfig(loadResource(RESOURCE_NAME)));

    private final Properties conf;
    private final Supplier<KeyWidth> keyWidth = Suppliers.memoize(this::resolveKeyWidth);

    /**
     * Returns the configuration loaded from the classpath.
     */
    public static TrieConfig getDefault() {
        return DEFAULT.get();
    }

    public TrieConfig(Properties conf) {
        this.conf = requireNonNull(conf);
    }

    static Properties loadResource(String name) {
        Properties props = new Properties();
        ClassLoader loader = Optionals.or(Thread.currentThread().getContextClassLoader(),
                                          TrieConfig.class::getClassLoader);
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to load " + name, ex);
        }
        return props;
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(conf.getProperty(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    /**
     * Returns the default key width for new containers. Falls back to the
     * JVM data model when the setting is absent or malformed.
     */
    public KeyWidth keyWidth() {
        return keyWidth.get();
    }

    private KeyWidth resolveKeyWidth() {
        String value = Optionals.or(System.getProperty(KEY_WIDTH_KEY),
                                    () -> Optionals.or(System.getenv(KEY_WIDTH_ENV),
                                                       () -> conf.getProperty(KEY_WIDTH_KEY)));
        KeyWidth width = KeyWidth.nativeWidth();
        if (value != null) {
            Optional<KeyWidth> parsed = Optional.of(value)
                .flatMap(Optionals.of(s -> KeyWidth.ofBits(Integer.parseInt(s.trim()))));
            if (parsed.isPresent()) {
                width = parsed.get();
            } else {
                logger.log(Level.WARNING, "Ignoring malformed {0}={1}, using {2}",
                           new Object[]{KEY_WIDTH_KEY, value, width});
            }
        }
        logger.log(Level.FINE, "Default trie key width is {0}", width);
        return width;
    }

    public String toString() {
        return conf.toString();
    }
}
