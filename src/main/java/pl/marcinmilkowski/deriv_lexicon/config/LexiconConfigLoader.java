package pl.marcinmilkowski.deriv_lexicon.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.deriv_lexicon.forest.ForestLoader;
import pl.marcinmilkowski.deriv_lexicon.traversal.RenderStyle;
import pl.marcinmilkowski.deriv_lexicon.traversal.SubtreePrinter;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads lexicon tool settings from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "encoding": "UTF-8",
 *   "render_style": "unicode",
 *   "warn_on_noncontiguous": true
 * }
 *
 * Only "version" is required.
 */
public class LexiconConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(LexiconConfigLoader.class);

    public static final String DEFAULT_VERSION = "1.0";
    public static final Path DEFAULT_PATH = Path.of("config/lexicon.json");

    private final String version;
    private final Charset encoding;
    private final RenderStyle renderStyle;
    private final boolean warnOnNonContiguous;
    private final Path configPath;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the lexicon.json file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public LexiconConfigLoader(Path configPath) throws IOException {
        this.configPath = configPath;

        if (!Files.exists(configPath)) {
            throw new IOException("Lexicon config file not found: " + configPath);
        }

        String content = Files.readString(configPath);
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid JSON in lexicon config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty lexicon config: " + configPath);
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in lexicon config");
        }
        this.version = parsedVersion;

        this.encoding = parseCharset(root.containsKey("encoding") ? root.getString("encoding") : "UTF-8");
        this.renderStyle = RenderStyle.parse(root.getString("render_style"));
        this.warnOnNonContiguous = !root.containsKey("warn_on_noncontiguous") || root.getBooleanValue("warn_on_noncontiguous");

        logger.info("Loaded lexicon config version {} from {} (encoding {}, render style {})",
            version, configPath, encoding, renderStyle);
    }

    private LexiconConfigLoader() {
        this.configPath = null;
        this.version = DEFAULT_VERSION;
        this.encoding = StandardCharsets.UTF_8;
        this.renderStyle = RenderStyle.UNICODE;
        this.warnOnNonContiguous = true;
    }

    /**
     * Built-in settings, used when no config file is given.
     */
    public static LexiconConfigLoader defaults() {
        return new LexiconConfigLoader();
    }

    private static Charset parseCharset(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Empty 'encoding' in lexicon config");
        }
        try {
            if (!Charset.isSupported(name)) {
                throw new IllegalArgumentException("Unsupported encoding: " + name);
            }
        } catch (IllegalCharsetNameException e) {
            throw new IllegalArgumentException("Illegal encoding name: " + name, e);
        }
        return Charset.forName(name);
    }

    public ForestLoader createLoader() {
        return new ForestLoader(encoding, warnOnNonContiguous);
    }

    public SubtreePrinter createPrinter() {
        return new SubtreePrinter(renderStyle);
    }

    public String getVersion() {
        return version;
    }

    public Charset getEncoding() {
        return encoding;
    }

    public RenderStyle getRenderStyle() {
        return renderStyle;
    }

    public boolean isWarnOnNonContiguous() {
        return warnOnNonContiguous;
    }

    /**
     * @return the config file path, or null for built-in defaults
     */
    public Path getConfigPath() {
        return configPath;
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        if (configPath != null) root.put("config_path", configPath.toString());
        root.put("encoding", encoding.name());
        root.put("render_style", renderStyle.name().toLowerCase());
        root.put("warn_on_noncontiguous", warnOnNonContiguous);
        return root;
    }
}
