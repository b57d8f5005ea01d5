package com.example.motion_photo_muxer.service.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.common.RationalNumber;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfoAscii;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfoRationals;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Best-effort copy of capture metadata (camera, lens, exposure, capture time, location) from an
 * original still onto its converted JPEG. A source without EXIF is a warning, not an error.
 */
@Component
public class CaptureMetadataCopier {
    private static final Logger LOGGER = LoggerFactory.getLogger(CaptureMetadataCopier.class);

    /**
     * @return {@code true} when at least one field was written.
     */
    public boolean copy(Path source, Path jpeg) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(source.toFile());
        } catch (ImageProcessingException | IOException e) {
            LOGGER.warn("Cannot read capture metadata source={} err={}", source, e.toString());
            return false;
        }

        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (ifd0 == null && exif == null && gps == null) {
            LOGGER.warn("No EXIF data found in {}", source);
            return false;
        }

        Path temp = null;
        try {
            TiffOutputSet outputSet = existingOutputSet(jpeg);
            int fields = 0;
            TiffOutputDirectory root = outputSet.getOrCreateRootDirectory();
            if (ifd0 != null) {
                fields += putAscii(root, TiffTagConstants.TIFF_TAG_MAKE, ifd0.getString(ExifIFD0Directory.TAG_MAKE));
                fields += putAscii(root, TiffTagConstants.TIFF_TAG_MODEL, ifd0.getString(ExifIFD0Directory.TAG_MODEL));
                fields += putAscii(root, TiffTagConstants.TIFF_TAG_DATE_TIME, ifd0.getString(ExifIFD0Directory.TAG_DATETIME));
            }
            if (exif != null) {
                TiffOutputDirectory exifDirectory = outputSet.getOrCreateExifDirectory();
                fields += putAscii(exifDirectory, ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL,
                        exif.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL));
                fields += putAscii(exifDirectory, ExifTagConstants.EXIF_TAG_DATE_TIME_DIGITIZED,
                        exif.getString(ExifSubIFDDirectory.TAG_DATETIME_DIGITIZED));
                fields += putAscii(exifDirectory, ExifTagConstants.EXIF_TAG_LENS_MAKE,
                        exif.getString(ExifSubIFDDirectory.TAG_LENS_MAKE));
                fields += putAscii(exifDirectory, ExifTagConstants.EXIF_TAG_LENS_MODEL,
                        exif.getString(ExifSubIFDDirectory.TAG_LENS_MODEL));
                fields += putRational(exifDirectory, ExifTagConstants.EXIF_TAG_EXPOSURE_TIME,
                        exif.getRational(ExifSubIFDDirectory.TAG_EXPOSURE_TIME));
                fields += putRational(exifDirectory, ExifTagConstants.EXIF_TAG_FNUMBER,
                        exif.getRational(ExifSubIFDDirectory.TAG_FNUMBER));
                fields += putRational(exifDirectory, ExifTagConstants.EXIF_TAG_FOCAL_LENGTH,
                        exif.getRational(ExifSubIFDDirectory.TAG_FOCAL_LENGTH));
                Integer iso = exif.getInteger(ExifSubIFDDirectory.TAG_ISO_EQUIVALENT);
                if (iso != null && iso > 0 && iso <= Short.MAX_VALUE) {
                    exifDirectory.removeField(ExifTagConstants.EXIF_TAG_ISO);
                    exifDirectory.add(ExifTagConstants.EXIF_TAG_ISO, iso.shortValue());
                    fields++;
                }
            }
            if (gps != null) {
                GeoLocation location = gps.getGeoLocation();
                if (location != null && !location.isZero()) {
                    outputSet.setGpsInDegrees(location.getLongitude(), location.getLatitude());
                    fields++;
                }
            }
            if (fields == 0) {
                LOGGER.warn("EXIF in {} has no copyable fields", source);
                return false;
            }

            temp = Files.createTempFile(jpeg.toAbsolutePath().getParent(), ".exif-", ".part");
            try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(temp))) {
                new ExifRewriter().updateExifMetadataLossless(jpeg.toFile(), os, outputSet);
            }
            Files.move(temp, jpeg, REPLACE_EXISTING);
            temp = null;
            LOGGER.info("EXIF data copied source={} target={} fields={}", source, jpeg, fields);
            return true;
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("EXIF copy failed source={} target={} err={}", source, jpeg, e.toString());
            return false;
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOGGER.warn("Could not remove temp file path={} err={}", temp, e.toString());
                }
            }
        }
    }

    private TiffOutputSet existingOutputSet(Path jpeg) throws IOException {
        ImageMetadata current = Imaging.getMetadata(jpeg.toFile());
        if (current instanceof JpegImageMetadata jpegMetadata && jpegMetadata.getExif() != null) {
            TiffOutputSet set = jpegMetadata.getExif().getOutputSet();
            if (set != null) {
                return set;
            }
        }
        return new TiffOutputSet();
    }

    private int putRational(TiffOutputDirectory directory, TagInfoRationals tagInfo, Rational value) throws IOException {
        if (value == null || value.getDenominator() == 0) {
            return 0;
        }
        directory.removeField(tagInfo);
        directory.add(tagInfo, RationalNumber.valueOf(value.doubleValue()));
        return 1;
    }

    private int putAscii(TiffOutputDirectory directory, TagInfoAscii tagInfo, String value) throws IOException {
        if (value == null || value.isBlank()) {
            return 0;
        }
        directory.removeField(tagInfo);
        directory.add(tagInfo, value.trim());
        return 1;
    }
}
