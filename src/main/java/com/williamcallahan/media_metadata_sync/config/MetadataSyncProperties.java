/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.media_metadata_sync.config;

import com.williamcallahan.media_metadata_sync.types.AssetQualityPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "app")
public class MetadataSyncProperties {

    @NestedConfigurationProperty
    private Settings settings = new Settings();

    @NestedConfigurationProperty
    private Plex plex = new Plex();

    @NestedConfigurationProperty
    private Tmdb tmdb = new Tmdb();

    @NestedConfigurationProperty
    private Network network = new Network();

    @NestedConfigurationProperty
    private Metadata metadata = new Metadata();

    @NestedConfigurationProperty
    private Assets assets = new Assets();

    @NestedConfigurationProperty
    private Cleanup cleanup = new Cleanup();

    @NestedConfigurationProperty
    private SelectionSet posterSet = SelectionSet.posterDefaults();

    @NestedConfigurationProperty
    private SelectionSet seasonSet = SelectionSet.seasonDefaults();

    @NestedConfigurationProperty
    private SelectionSet backgroundSet = SelectionSet.backgroundDefaults();

    @NestedConfigurationProperty
    private Workers workers = new Workers();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    // Getters and setters
    public Settings getSettings() { return settings; }
    public void setSettings(Settings settings) { this.settings = settings; }

    public Plex getPlex() { return plex; }
    public void setPlex(Plex plex) { this.plex = plex; }

    public Tmdb getTmdb() { return tmdb; }
    public void setTmdb(Tmdb tmdb) { this.tmdb = tmdb; }

    public Network getNetwork() { return network; }
    public void setNetwork(Network network) { this.network = network; }

    public Metadata getMetadata() { return metadata; }
    public void setMetadata(Metadata metadata) { this.metadata = metadata; }

    public Assets getAssets() { return assets; }
    public void setAssets(Assets assets) { this.assets = assets; }

    public Cleanup getCleanup() { return cleanup; }
    public void setCleanup(Cleanup cleanup) { this.cleanup = cleanup; }

    public SelectionSet getPosterSet() { return posterSet; }
    public void setPosterSet(SelectionSet posterSet) { this.posterSet = posterSet; }

    public SelectionSet getSeasonSet() { return seasonSet; }
    public void setSeasonSet(SelectionSet seasonSet) { this.seasonSet = seasonSet; }

    public SelectionSet getBackgroundSet() { return backgroundSet; }
    public void setBackgroundSet(SelectionSet backgroundSet) { this.backgroundSet = backgroundSet; }

    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    // Nested configuration classes
    public static class Settings {
        private boolean dryRun = false;
        private boolean runOnStartup = false;
        private boolean scheduleEnabled = true;
        private String scheduleCron = "0 0 6,18 * * *";
        private String mode = "kometa";
        private String path = "./kometa";

        public boolean isDryRun() { return dryRun; }
        public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

        public boolean isScheduleEnabled() { return scheduleEnabled; }
        public void setScheduleEnabled(boolean scheduleEnabled) { this.scheduleEnabled = scheduleEnabled; }

        public String getScheduleCron() { return scheduleCron; }
        public void setScheduleCron(String scheduleCron) { this.scheduleCron = scheduleCron; }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public boolean isKometaMode() {
            return !"plex".equalsIgnoreCase(mode);
        }
    }

    public static class Plex {
        private String url = "http://localhost:32400";
        private String token;
        private List<String> libraries = new ArrayList<>(List.of("Movies", "TV Shows"));

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public List<String> getLibraries() { return libraries; }
        public void setLibraries(List<String> libraries) { this.libraries = libraries; }
    }

    public static class Tmdb {
        private String apiKey;
        private String baseUrl = "https://api.themoviedb.org/3";
        private String imageBaseUrl = "https://image.tmdb.org/t/p/original";
        private String language = "en";
        private String region = "US";
        private List<String> fallbackLanguages = new ArrayList<>();

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getImageBaseUrl() { return imageBaseUrl; }
        public void setImageBaseUrl(String imageBaseUrl) { this.imageBaseUrl = imageBaseUrl; }

        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public List<String> getFallbackLanguages() { return fallbackLanguages; }
        public void setFallbackLanguages(List<String> fallbackLanguages) { this.fallbackLanguages = fallbackLanguages; }

        /**
         * Two-letter image language derived from the configured metadata language ("en-US" becomes "en")
         */
        public String getImageLanguage() {
            if (language == null || language.isBlank()) {
                return "en";
            }
            return language.split("-")[0];
        }
    }

    public static class Network {
        private int maxRetries = 3;
        private Duration delay = Duration.ofSeconds(2);
        private double backoffFactor = 2.0;
        private Duration timeout = Duration.ofSeconds(20);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }

        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Metadata {
        private boolean runBasic = true;
        private boolean runEnhanced = true;
        private Set<String> ignoredFields = new LinkedHashSet<>(List.of("runtime", "guest"));

        public boolean isRunBasic() { return runBasic; }
        public void setRunBasic(boolean runBasic) { this.runBasic = runBasic; }

        public boolean isRunEnhanced() { return runEnhanced; }
        public void setRunEnhanced(boolean runEnhanced) { this.runEnhanced = runEnhanced; }

        public Set<String> getIgnoredFields() { return ignoredFields; }
        public void setIgnoredFields(Set<String> ignoredFields) { this.ignoredFields = ignoredFields; }
    }

    public static class Assets {
        private String path = "./kometa/assets";
        private boolean runPoster = true;
        private boolean runSeason = true;
        private boolean runBackground = false;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public boolean isRunPoster() { return runPoster; }
        public void setRunPoster(boolean runPoster) { this.runPoster = runPoster; }

        public boolean isRunSeason() { return runSeason; }
        public void setRunSeason(boolean runSeason) { this.runSeason = runSeason; }

        public boolean isRunBackground() { return runBackground; }
        public void setRunBackground(boolean runBackground) { this.runBackground = runBackground; }
    }

    public static class Cleanup {
        private boolean runProcess = false;

        public boolean isRunProcess() { return runProcess; }
        public void setRunProcess(boolean runProcess) { this.runProcess = runProcess; }
    }

    /**
     * Selection thresholds for one asset slot (poster, season poster, background)
     */
    public static class SelectionSet {
        private int preferredWidth;
        private int preferredHeight;
        private int minWidth;
        private int minHeight;
        private double preferredVote = 5.0;
        private double voteRelaxed = 3.5;
        private double voteThreshold = 5.0;

        static SelectionSet posterDefaults() {
            SelectionSet set = new SelectionSet();
            set.preferredWidth = 2000;
            set.preferredHeight = 3000;
            set.minWidth = 1000;
            set.minHeight = 1500;
            return set;
        }

        static SelectionSet seasonDefaults() {
            SelectionSet set = posterDefaults();
            set.voteRelaxed = 0.5;
            set.voteThreshold = 3.0;
            return set;
        }

        static SelectionSet backgroundDefaults() {
            SelectionSet set = new SelectionSet();
            set.preferredWidth = 3840;
            set.preferredHeight = 2160;
            set.minWidth = 1920;
            set.minHeight = 1080;
            return set;
        }

        public int getPreferredWidth() { return preferredWidth; }
        public void setPreferredWidth(int preferredWidth) { this.preferredWidth = preferredWidth; }

        public int getPreferredHeight() { return preferredHeight; }
        public void setPreferredHeight(int preferredHeight) { this.preferredHeight = preferredHeight; }

        public int getMinWidth() { return minWidth; }
        public void setMinWidth(int minWidth) { this.minWidth = minWidth; }

        public int getMinHeight() { return minHeight; }
        public void setMinHeight(int minHeight) { this.minHeight = minHeight; }

        public double getPreferredVote() { return preferredVote; }
        public void setPreferredVote(double preferredVote) { this.preferredVote = preferredVote; }

        public double getVoteRelaxed() { return voteRelaxed; }
        public void setVoteRelaxed(double voteRelaxed) { this.voteRelaxed = voteRelaxed; }

        public double getVoteThreshold() { return voteThreshold; }
        public void setVoteThreshold(double voteThreshold) { this.voteThreshold = voteThreshold; }

        public AssetQualityPolicy toPolicy() {
            return new AssetQualityPolicy(preferredVote, voteRelaxed, voteThreshold,
                preferredWidth, preferredHeight, minWidth, minHeight);
        }
    }

    public static class Workers {
        private int concurrency = 5;
        private Duration batchTimeout = Duration.ofMinutes(30);
        private Duration abandonGrace = Duration.ofSeconds(30);

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public Duration getBatchTimeout() { return batchTimeout; }
        public void setBatchTimeout(Duration batchTimeout) { this.batchTimeout = batchTimeout; }

        public Duration getAbandonGrace() { return abandonGrace; }
        public void setAbandonGrace(Duration abandonGrace) { this.abandonGrace = abandonGrace; }
    }

    public static class Cache {
        private String directory = "./cache";
        private String identifierFile = "tmdb_cache.json";
        private String failedFile = "failed_items.json";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getIdentifierFile() { return identifierFile; }
        public void setIdentifierFile(String identifierFile) { this.identifierFile = identifierFile; }

        public String getFailedFile() { return failedFile; }
        public void setFailedFile(String failedFile) { this.failedFile = failedFile; }
    }
}
