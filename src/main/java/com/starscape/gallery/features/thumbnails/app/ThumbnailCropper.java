package com.starscape.gallery.features.thumbnails.app;

import com.starscape.gallery.common.config.GalleryProperties;
import net.coobird.thumbnailator.Thumbnails;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Decodes downloaded image bytes and turns them into square gallery thumbnails.
 */
@Component
public class ThumbnailCropper {

    private final int thumbnailSize;

    @Autowired
    public ThumbnailCropper(GalleryProperties properties) {
        this(properties.getFetch().getThumbnailSize());
    }

    public ThumbnailCropper(int thumbnailSize) {
        if (thumbnailSize <= 0) {
            throw new IllegalArgumentException("Thumbnail size must be positive");
        }
        this.thumbnailSize = thumbnailSize;
    }

    /**
     * Decode image bytes.
     * @throws IOException when the bytes are not a readable image or decode to an empty one
     */
    public BufferedImage decode(byte[] imageBytes) throws IOException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IOException("Empty image data");
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        if (image == null) {
            throw new IOException("Failed to read image");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new IOException("Image has no pixels");
        }
        return image;
    }

    /**
     * Crop the largest centered square and scale it to the thumbnail edge.
     */
    public BufferedImage cropToSquare(BufferedImage image) throws IOException {
        int width = image.getWidth();
        int height = image.getHeight();
        int side = Math.min(width, height);
        int x = (width - side) / 2;
        int y = (height - side) / 2;

        return Thumbnails.of(image)
                .sourceRegion(x, y, side, side)
                .size(thumbnailSize, thumbnailSize)
                .asBufferedImage();
    }

    public int getThumbnailSize() {
        return thumbnailSize;
    }
}
