package org.simforge.compiler.backend;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import org.simforge.compiler.backend.remote.RemoteSettings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Backend configuration from the {@code simforge.backend} section.
 *
 * @param type                     The backend implementation.
 * @param modelFrame               Path of the frame new objects are created in.
 * @param connector                Path of the connector used for connections.
 * @param userObjects              Path of the folder holding templates and material units.
 * @param templates                Template name to absolute path overrides.
 * @param materialUnitTemplatePath Path of the template material units are derived from.
 * @param remote                   Settings of the remote command channel.
 */
public record BackendSettings(
        BackendType type,
        String modelFrame,
        String connector,
        String userObjects,
        Map<String, String> templates,
        String materialUnitTemplatePath,
        RemoteSettings remote
) {

    public static final String DEFAULT_MODEL_FRAME = ".Models.Model";
    public static final String DEFAULT_CONNECTOR = ".MaterialFlow.Connector";
    public static final String DEFAULT_USER_OBJECTS = ".UserObjects";
    public static final String DEFAULT_MATERIAL_UNIT_TEMPLATE = ".UserObjects.PartA";

    public BackendSettings {
        templates = Map.copyOf(templates);
    }

    /**
     * Settings with default framework paths and no template overrides.
     */
    public static BackendSettings defaults(BackendType type) {
        return new BackendSettings(type, DEFAULT_MODEL_FRAME, DEFAULT_CONNECTOR, DEFAULT_USER_OBJECTS,
                Map.of(), DEFAULT_MATERIAL_UNIT_TEMPLATE, RemoteSettings.DEFAULTS);
    }

    /**
     * @param backend The {@code simforge.backend} section.
     */
    public static BackendSettings fromConfig(Config backend) {
        Map<String, String> templates = new LinkedHashMap<>();
        if (backend.hasPath("templates")) {
            ConfigObject templateObject = backend.getObject("templates");
            for (String name : templateObject.keySet()) {
                templates.put(name, String.valueOf(templateObject.get(name).unwrapped()));
            }
        }
        return new BackendSettings(
                BackendType.fromConfigName(backend.getString("type")),
                stringOr(backend, "model-frame", DEFAULT_MODEL_FRAME),
                stringOr(backend, "connector", DEFAULT_CONNECTOR),
                stringOr(backend, "user-objects", DEFAULT_USER_OBJECTS),
                templates,
                stringOr(backend, "material-units.template-path", DEFAULT_MATERIAL_UNIT_TEMPLATE),
                backend.hasPath("remote") ? RemoteSettings.fromConfig(backend.getConfig("remote")) : RemoteSettings.DEFAULTS);
    }

    private static String stringOr(Config config, String path, String fallback) {
        return config.hasPath(path) ? config.getString(path) : fallback;
    }
}
