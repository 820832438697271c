/**
 * Deterministic locations of asset files
 *
 * @author William Callahan
 *
 * Features:
 * - Kometa mode: {assets}/{library}/{item dir}/poster.jpg, fanart.jpg, SeasonNN.jpg
 * - Plex mode: files next to the media, season posters in "Season NN" folders
 * - Temporary download files live in the library's asset folder
 */
package com.williamcallahan.media_metadata_sync.service.image;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Component
public class AssetPathResolver {

    public static final String POSTER_FILE = "poster.jpg";
    public static final String BACKGROUND_FILE = "fanart.jpg";
    public static final String TEMP_PREFIX = "temp_";

    private static final Pattern SEASON_FOLDER = Pattern.compile("Season \\d+");

    private final Path assetsRoot;
    private final boolean kometaMode;

    @Autowired
    public AssetPathResolver(MetadataSyncProperties properties) {
        this(Paths.get(properties.getAssets().getPath()), properties.getSettings().isKometaMode());
    }

    public AssetPathResolver(Path assetsRoot, boolean kometaMode) {
        this.assetsRoot = assetsRoot;
        this.kometaMode = kometaMode;
    }

    public Optional<Path> posterPath(MediaItem item) {
        return itemFolder(item).map(dir -> dir.resolve(POSTER_FILE));
    }

    public Optional<Path> backgroundPath(MediaItem item) {
        return itemFolder(item).map(dir -> dir.resolve(BACKGROUND_FILE));
    }

    public Optional<Path> seasonPosterPath(MediaItem item, int seasonNumber) {
        String fileName = seasonFileName(seasonNumber);
        if (kometaMode) {
            return itemFolder(item).map(dir -> dir.resolve(fileName));
        }
        return itemFolder(item).map(dir -> dir.resolve(String.format("Season %02d", seasonNumber)).resolve(fileName));
    }

    /**
     * Fresh temporary file path for a download, never an existing file
     */
    public Path tempFile(String libraryName) {
        return assetsRoot.resolve(libraryName).resolve(TEMP_PREFIX + UUID.randomUUID() + ".jpg");
    }

    public Path getAssetsRoot() {
        return assetsRoot;
    }

    public boolean isKometaMode() {
        return kometaMode;
    }

    /**
     * Name of the item directory owning an asset file; skips a "Season NN" folder in plex mode
     */
    public static String owningDirectoryName(Path assetFile) {
        Path parent = assetFile.getParent();
        if (parent == null || parent.getFileName() == null) {
            return "";
        }
        String name = parent.getFileName().toString();
        if (SEASON_FOLDER.matcher(name).matches() && parent.getParent() != null && parent.getParent().getFileName() != null) {
            return parent.getParent().getFileName().toString();
        }
        return name;
    }

    static String seasonFileName(int seasonNumber) {
        return String.format("Season%02d.jpg", seasonNumber);
    }

    private Optional<Path> itemFolder(MediaItem item) {
        if (kometaMode) {
            return Optional.of(assetsRoot.resolve(item.libraryName()).resolve(item.directoryName()));
        }
        return Optional.ofNullable(item.itemDirectory());
    }
}
