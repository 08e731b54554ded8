package com.equipinspect.app.modules.photo.application;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.MemoryCacheImageOutputStream;

import com.equipinspect.app.global.config.StorageProperties;
import com.equipinspect.app.global.error.StorageException;
import com.equipinspect.app.global.error.TooLargeException;
import com.equipinspect.app.global.error.UnsupportedFormatException;
import com.equipinspect.app.modules.photo.domain.PhotoFormat;
import com.equipinspect.app.modules.photo.domain.ProcessedPhoto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Checks uploaded images and writes the per-record copies under
 * {@code <uploads>/record-<id>/photo-<n>/}: the untouched original, an optimized JPEG and a
 * thumbnail. Every call writes a fresh {@code photo-<n>} set, so a replacement never touches the
 * files the record currently points at. File names and encoder settings are fixed, so processing
 * the same input twice yields byte-identical files.
 */
@Component
public class PhotoHandler {

    private static final Logger log = LoggerFactory.getLogger(PhotoHandler.class);

    static final String OPTIMIZED_FILE = "optimized.jpg";
    static final String THUMBNAIL_FILE = "thumbnail.jpg";

    private static final String RECORD_PREFIX = "record-";
    private static final String PHOTO_SET_PREFIX = "photo-";

    private final StorageProperties storageProperties;
    private final PhotoProperties photoProperties;

    public PhotoHandler(StorageProperties storageProperties, PhotoProperties photoProperties) {
        this.storageProperties = storageProperties;
        this.photoProperties = photoProperties;
    }

    public void validate(Path file) {
        decode(file);
    }

    public ProcessedPhoto process(Path source, long recordId) {
        DecodedPhoto decoded = decode(source);
        Path directory;
        try {
            directory = createPhotoSet(recordDirectory(recordId));
        } catch (IOException ex) {
            throw new StorageException(StorageException.FILE_WRITE_FAILED,
                    "Could not create photo directory for record " + recordId, ex);
        }
        Path original = directory.resolve("original." + decoded.extension());
        Path optimized = directory.resolve(OPTIMIZED_FILE);
        Path thumbnail = directory.resolve(THUMBNAIL_FILE);
        try {
            Files.copy(source, original);
            writeJpeg(fitInto(decoded.image(), photoProperties.getMaxWidth(), photoProperties.getMaxHeight()),
                    optimized, photoProperties.getQuality());
            int thumbnailSize = photoProperties.getThumbnailSize();
            writeJpeg(fitInto(decoded.image(), thumbnailSize, thumbnailSize),
                    thumbnail, photoProperties.getThumbnailQuality());
        } catch (IOException ex) {
            StorageException failure = new StorageException(StorageException.FILE_WRITE_FAILED,
                    "Could not write photo files for record " + recordId, ex);
            try {
                FileSystemUtils.deleteRecursively(directory);
            } catch (IOException cleanupEx) {
                failure.addSuppressed(cleanupEx);
            }
            throw failure;
        }
        log.info("Stored photo for record {} in {} ({}x{} {})", recordId, directory.getFileName(),
                decoded.image().getWidth(), decoded.image().getHeight(), decoded.format());
        return new ProcessedPhoto(original, optimized, thumbnail);
    }

    /**
     * Removes one photo set of a record, and the record directory once it holds nothing else.
     * A directory outside the record's own directory is left alone.
     */
    public void discard(long recordId, Path photoDirectory) {
        Objects.requireNonNull(photoDirectory, "photoDirectory is required");
        Path recordDirectory = normalized(recordDirectory(recordId));
        Path target = normalized(photoDirectory);
        if (!recordDirectory.equals(target.getParent())) {
            log.warn("Not discarding {}: it is not a photo set of record {}", photoDirectory, recordId);
            return;
        }
        try {
            if (FileSystemUtils.deleteRecursively(target)) {
                log.info("Removed photo set {}", target);
            }
            deleteIfEmpty(recordDirectory);
        } catch (IOException ex) {
            throw new StorageException(StorageException.FILE_WRITE_FAILED,
                    "Could not remove photo set " + target, ex);
        }
    }

    /**
     * Removes every photo file of a record.
     */
    public void delete(long recordId) {
        Path directory = recordDirectory(recordId);
        try {
            if (FileSystemUtils.deleteRecursively(directory)) {
                log.info("Removed photo directory {}", directory);
            }
        } catch (IOException ex) {
            throw new StorageException(StorageException.FILE_WRITE_FAILED,
                    "Could not remove photo directory " + directory, ex);
        }
    }

    /**
     * Deletes photo files no record points at: directories of unknown records and photo sets
     * other than the referenced ones. Must not run while a photo is being attached.
     *
     * @param recordIds ids of every stored record, soft-deleted ones included
     * @param referencedSets photo set directories the stored records point at
     * @return number of directories removed
     */
    public int cleanupOrphans(Set<Long> recordIds, Set<Path> referencedSets) {
        Path uploads = storageProperties.uploadsPath();
        if (!Files.isDirectory(uploads)) {
            return 0;
        }
        Set<Path> keep = referencedSets.stream().map(PhotoHandler::normalized).collect(Collectors.toSet());
        int removed = 0;
        try {
            for (Path recordDirectory : listDirectories(uploads)) {
                Long recordId = parseSuffix(recordDirectory, RECORD_PREFIX);
                if (recordId == null) {
                    continue;
                }
                if (!recordIds.contains(recordId)) {
                    delete(recordId);
                    removed++;
                    continue;
                }
                for (Path photoSet : listDirectories(recordDirectory)) {
                    if (!keep.contains(normalized(photoSet))) {
                        FileSystemUtils.deleteRecursively(photoSet);
                        removed++;
                    }
                }
                deleteIfEmpty(recordDirectory);
            }
        } catch (IOException ex) {
            throw new StorageException(StorageException.FILE_WRITE_FAILED,
                    "Could not clean up photo directories under " + uploads, ex);
        }
        if (removed > 0) {
            log.info("Removed {} orphaned photo directories under {}", removed, uploads);
        }
        return removed;
    }

    public Path recordDirectory(long recordId) {
        return storageProperties.uploadsPath().resolve("record-" + recordId);
    }

    private DecodedPhoto decode(Path file) {
        Objects.requireNonNull(file, "file is required");
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new StorageException(StorageException.FILE_NOT_READABLE, "Cannot read file " + file);
        }
        String extension = PhotoFormat.extensionOf(file.getFileName().toString());
        PhotoFormat format = PhotoFormat.fromExtension(extension)
                .orElseThrow(() -> new UnsupportedFormatException(file,
                        "Unsupported file extension '" + extension + "'"));

        long size;
        try {
            size = Files.size(file);
        } catch (IOException ex) {
            throw new StorageException(StorageException.FILE_NOT_READABLE, "Cannot read file " + file, ex);
        }
        long limit = photoProperties.getMaxFileSize().toBytes();
        if (size > limit) {
            throw new TooLargeException(file, size, limit);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException ex) {
            throw new UnsupportedFormatException(file, "File content is not a valid image");
        }
        if (image == null) {
            throw new UnsupportedFormatException(file, "File content is not a valid image");
        }
        return new DecodedPhoto(format, extension, image);
    }

    /**
     * Scales the image down to fit the box and flattens transparency onto white.
     */
    static BufferedImage fitInto(BufferedImage source, int maxWidth, int maxHeight) {
        double scale = Math.min(1.0, Math.min(
                (double) maxWidth / source.getWidth(),
                (double) maxHeight / source.getHeight()));
        int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scale));

        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = target.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setColor(Color.WHITE);
            g2d.fillRect(0, 0, width, height);
            g2d.drawImage(source, 0, 0, width, height, null);
        } finally {
            g2d.dispose();
        }
        return target;
    }

    private static void writeJpeg(BufferedImage image, Path target, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(quality);

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (MemoryCacheImageOutputStream output = new MemoryCacheImageOutputStream(buffer)) {
            writer.setOutput(output);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        Files.write(target, buffer.toByteArray());
    }

    private static Path createPhotoSet(Path recordDirectory) throws IOException {
        Files.createDirectories(recordDirectory);
        long next = 1;
        for (Path existing : listDirectories(recordDirectory)) {
            Long number = parseSuffix(existing, PHOTO_SET_PREFIX);
            if (number != null && number >= next) {
                next = number + 1;
            }
        }
        return Files.createDirectory(recordDirectory.resolve(PHOTO_SET_PREFIX + next));
    }

    private static List<Path> listDirectories(Path parent) throws IOException {
        try (Stream<Path> entries = Files.list(parent)) {
            return entries.filter(Files::isDirectory).sorted().toList();
        }
    }

    private static Long parseSuffix(Path directory, String prefix) {
        String name = directory.getFileName().toString();
        if (!name.startsWith(prefix)) {
            return null;
        }
        try {
            return Long.parseLong(name.substring(prefix.length()));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static void deleteIfEmpty(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        boolean empty;
        try (Stream<Path> entries = Files.list(directory)) {
            empty = entries.findAny().isEmpty();
        }
        if (empty) {
            Files.delete(directory);
        }
    }

    private static Path normalized(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private record DecodedPhoto(PhotoFormat format, String extension, BufferedImage image) {
    }
}
