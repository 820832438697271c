/**
 * Reads pixel dimensions from image files without decoding the whole raster
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.image;

import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

@Component
public class ImageDimensionReader {

    public record Dimensions(int width, int height) {

        /**
         * True when this image is strictly wider or strictly taller than the other
         */
        public boolean exceedsEither(Dimensions other) {
            return width > other.width || height > other.height;
        }
    }

    /**
     * @param file image file
     * @return pixel dimensions of the first image in the file
     * @throws IOException when the file cannot be opened or no decoder recognizes it
     */
    public Dimensions read(Path file) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                throw new IOException("Cannot open image stream for " + file);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new IOException("No image decoder recognizes " + file);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new Dimensions(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }
}
