/*
 * Image-Batch - Batch Image Processing
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.image.batch.actions;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import net.boyechko.image.batch.action.ActionResult;
import net.boyechko.image.batch.action.ImageAction;
import net.boyechko.image.batch.image.ImageFormat;
import net.boyechko.image.batch.image.ImageHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-saves PNG files at the highest deflate level. Pixel data is unchanged; the file is only
 * rewritten when the new encoding is smaller.
 */
public class CompressPngAction implements ImageAction {
    public static final String ID = "compress_png";

    private static final Logger logger = LoggerFactory.getLogger(CompressPngAction.class);

    // ImageIO maps quality 0.0 to the strongest deflate level
    private static final float MAX_COMPRESSION_QUALITY = 0.0f;

    @Override
    public ActionResult execute(ImageHandle handle) throws Exception {
        String fileName = handle.path().getFileName().toString();
        if (handle.format() != ImageFormat.PNG) {
            return ActionResult.warn(fileName + " is not a PNG file; skipped");
        }
        if (!handle.isWritable()) {
            return ActionResult.warn(fileName + " is read-only; skipped");
        }

        long originalSize = handle.size();
        byte[] compressed = encode(handle.image());
        long saved = originalSize - compressed.length;
        logger.debug("{}: {} -> {} bytes", fileName, originalSize, compressed.length);

        if (saved <= 0) {
            return ActionResult.warn("Compression did not save any space on disk");
        }

        handle.replaceContent(compressed);
        return ActionResult.passMutated(
                String.format(Locale.ROOT, "Compression saved %.2f KB on disk", saved / 1024.0));
    }

    static byte[] encode(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers =
                ImageIO.getImageWritersByFormatName(ImageFormat.PNG.imageIoName());
        if (!writers.hasNext()) {
            throw new IOException("No PNG writer available");
        }
        ImageWriter writer = writers.next();
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(MAX_COMPRESSION_QUALITY);
            }
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (ImageOutputStream out = ImageIO.createImageOutputStream(buffer)) {
                writer.setOutput(out);
                writer.write(null, new IIOImage(image, null, null), param);
            }
            return buffer.toByteArray();
        } finally {
            writer.dispose();
        }
    }
}
