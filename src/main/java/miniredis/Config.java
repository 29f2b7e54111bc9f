package miniredis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import miniredis.utils.Log;

import java.io.File;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_FILE = "miniredis.yaml";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 31337;
    public static final int DEFAULT_MAX_CLIENTS = 64;

    public String host = DEFAULT_HOST;
    public int port = DEFAULT_PORT;
    public int maxClients = DEFAULT_MAX_CLIENTS;
    public int workerThreads = 0; // 0 = Netty default (2 * cores)
    public int statsIntervalSeconds = 5; // 0 = off
    public boolean debug = false;

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        return load(filename, System.getenv());
    }

    static Config load(String filename, Map<String, String> env) {
        File f = new File(filename);
        // Accept both .yaml and .yml
        if (!f.exists() && filename.endsWith(".yaml")) {
            File ymlFile = new File(filename.substring(0, filename.length() - ".yaml".length()) + ".yml");
            if (ymlFile.exists()) f = ymlFile;
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
                Config loaded = mapper.readValue(f, Config.class);
                // An empty YAML document maps to null
                if (loaded != null) config = loaded;
                Log.info("Loaded config from " + f.getPath());
            } catch (Exception e) {
                Log.warn("Failed to load config " + f.getPath() + " (" + e.getMessage() + "). Using defaults.");
                config = new Config();
            }
        }

        applyEnv(config, env);
        config.validate();
        return config;
    }

    private static void applyEnv(Config config, Map<String, String> env) {
        String host = env.get("MINIREDIS_HOST");
        if (host != null && !host.isBlank()) {
            config.host = host.trim();
        }
        String port = env.get("MINIREDIS_PORT");
        if (port != null && !port.isBlank()) {
            try {
                config.port = Integer.parseInt(port.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("MINIREDIS_PORT is not a number: " + port, e);
            }
        }
    }

    public void validate() {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be empty");
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (maxClients < 1) throw new IllegalArgumentException("maxClients must be at least 1: " + maxClients);
        if (workerThreads < 0) throw new IllegalArgumentException("workerThreads must not be negative: " + workerThreads);
        if (statsIntervalSeconds < 0) throw new IllegalArgumentException("statsIntervalSeconds must not be negative: " + statsIntervalSeconds);
    }
}
