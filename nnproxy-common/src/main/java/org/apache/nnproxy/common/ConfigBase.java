// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.nnproxy.common;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileReader;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.reflect.Field;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the static {@link ConfField} fields of a config class from a properties file.
 * Fields may be int or boolean.
 * <p>
 * A value may reference a system property or an environment variable as {@code ${NAME}},
 * system properties win over the environment.
 */
public class ConfigBase {
    private static final Logger LOG = LogManager.getLogger(ConfigBase.class);

    @Retention(RetentionPolicy.RUNTIME)
    public @interface ConfField {
        boolean mutable() default false;

        String comment() default "";

        Class<? extends ConfHandler> callback() default DefaultConfHandler.class;
    }

    public interface ConfHandler {
        void handle(Field field, String confVal) throws Exception;
    }

    static class DefaultConfHandler implements ConfHandler {
        @Override
        public void handle(Field field, String confVal) throws Exception {
            setConfigField(field, confVal);
        }
    }

    private static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{([^}]*)\\}");

    public static Class<? extends ConfigBase> confClass;
    public static Map<String, Field> confFields;

    public void init(String configFile) throws Exception {
        collectFields();
        initConf(configFile);
    }

    // config in customConfFile will overwrite the config in confFile, the file is optional
    public void initCustom(String customConfFile) throws Exception {
        File file = new File(customConfFile);
        if (file.exists() && file.isFile()) {
            initConf(customConfFile);
        }
    }

    public void init(Properties props) throws Exception {
        collectFields();
        replacedByEnv(props);
        setFields(props);
    }

    private void collectFields() {
        confClass = this.getClass();
        confFields = Maps.newHashMap();
        for (Field field : confClass.getFields()) {
            if (field.getAnnotation(ConfField.class) != null) {
                confFields.put(field.getName(), field);
            }
        }
    }

    private void initConf(String confFile) throws Exception {
        Properties props = new Properties();
        try (FileReader fr = new FileReader(confFile)) {
            props.load(fr);
        }
        replacedByEnv(props);
        setFields(props);
        LOG.info("loaded config from {}", confFile);
    }

    public static Map<String, String> dump() {
        Map<String, String> map = new TreeMap<>();
        if (confClass == null) {
            return map;
        }
        for (Field f : confClass.getFields()) {
            if (f.getAnnotation(ConfField.class) != null) {
                map.put(f.getName(), getConfValue(f));
            }
        }
        return map;
    }

    public static String getConfValue(Field field) {
        try {
            return String.valueOf(field.get(null));
        } catch (IllegalAccessException e) {
            return String.format("Failed to get config %s: %s", field.getName(), e.getMessage());
        }
    }

    // replace "${CONFIG_VALUE}" with the system property or env variable CONFIG_VALUE
    private void replacedByEnv(Properties props) throws ConfigException {
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key);
            Matcher m = ENV_PATTERN.matcher(value);
            while (m.find()) {
                String envValue = System.getProperty(m.group(1));
                envValue = (envValue != null) ? envValue : System.getenv(m.group(1));
                if (envValue == null) {
                    throw new ConfigException("no such env variable: " + m.group(1));
                }
                value = value.replace("${" + m.group(1) + "}", envValue);
            }
            props.setProperty(key, value);
        }
    }

    private static void setFields(Properties props) throws Exception {
        for (Field f : confClass.getFields()) {
            if (f.getAnnotation(ConfField.class) == null) {
                continue;
            }

            String confVal = props.getProperty(f.getName());
            if (Strings.isNullOrEmpty(confVal)) {
                continue;
            }

            setConfigField(f, confVal);
        }
    }

    private static void setConfigField(Field f, String confVal) throws Exception {
        confVal = confVal.trim();

        switch (f.getType().getSimpleName()) {
            case "int":
                f.setInt(null, Integer.parseInt(confVal));
                break;
            case "boolean":
                if (isBoolean(confVal)) {
                    f.setBoolean(null, Boolean.parseBoolean(confVal));
                }
                break;
            default:
                throw new ConfigException("unknown type: " + f.getType().getSimpleName());
        }
    }

    private static boolean isBoolean(String s) {
        if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) {
            return true;
        }
        throw new IllegalArgumentException("type mismatch");
    }

    public static synchronized void setMutableConfig(String key, String value) throws ConfigException {
        Field field = confFields == null ? null : confFields.get(key);
        if (field == null) {
            throw new ConfigException("Config '" + key + "' does not exist");
        }

        ConfField anno = field.getAnnotation(ConfField.class);
        if (!anno.mutable()) {
            throw new ConfigException("Config '" + key + "' is not mutable");
        }

        try {
            anno.callback().getDeclaredConstructor().newInstance().handle(field, value);
        } catch (Exception e) {
            throw new ConfigException("Failed to set config '" + key + "'. err: " + e.getMessage(), e);
        }

        LOG.info("set config {} to {}", key, value);
    }
}
