package org.hybridcloud.dtss.device;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The registry of named quantum device presets, loaded from {@value #CATALOG_RESOURCE}.
 * Preset names are matched case-insensitively.
 */
@Singleton
public final class DeviceCatalog {
  private static final Logger LOG = Logger.getLogger(DeviceCatalog.class.getName());
  private static final Gson GSON = new Gson();

  public static final String CATALOG_RESOURCE = "device-catalog.json";

  private final Map<String, DeviceProfile> presets = new LinkedHashMap<>();

  @Inject
  public DeviceCatalog() {
    this(CATALOG_RESOURCE);
  }

  @VisibleForTesting
  DeviceCatalog(final String resource) {
    for (final DeviceProfile.Builder builder : readPresets(resource)) {
      register(builder.build());
    }

    LOG.log(Level.INFO, MessageFormat.format("Loaded {0} device presets from {1}.", presets.size(), resource));
  }

  private static List<DeviceProfile.Builder> readPresets(final String resource) {
    try (InputStream in = DeviceCatalog.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("Device catalog not found: " + resource);
      }

      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        final CatalogFile file = GSON.fromJson(reader, CatalogFile.class);
        if (file == null || file.presets == null) {
          throw new IllegalArgumentException("Device catalog " + resource + " has no presets.");
        }

        return file.presets;
      }
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    } catch (final JsonParseException e) {
      throw new IllegalArgumentException("Malformed device catalog " + resource, e);
    }
  }

  /**
   * Adds a preset, replacing any preset of the same name.
   */
  public void register(final DeviceProfile profile) {
    final DeviceProfile replaced = presets.put(key(profile.getName()), profile);
    if (replaced != null) {
      LOG.log(Level.WARNING, "Replacing device preset " + replaced.getName());
    }
  }

  /**
   * @throws IllegalArgumentException if no preset has that name
   */
  public DeviceProfile getProfile(final String preset) {
    final DeviceProfile profile = preset == null ? null : presets.get(key(preset));
    if (profile == null) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Unknown device preset {0}, known presets are {1}.", preset, getPresetNames()));
    }

    return profile;
  }

  public boolean hasPreset(final String preset) {
    return presets.containsKey(key(preset));
  }

  public List<String> getPresetNames() {
    final List<String> names = new ArrayList<>();
    for (final DeviceProfile profile : presets.values()) {
      names.add(profile.getName());
    }

    return Collections.unmodifiableList(names);
  }

  private static String key(final String preset) {
    return preset.toLowerCase(Locale.ROOT);
  }

  private static final class CatalogFile {
    @SerializedName("presets")
    private List<DeviceProfile.Builder> presets;
  }
}
