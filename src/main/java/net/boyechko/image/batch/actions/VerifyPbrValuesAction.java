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

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import net.boyechko.image.batch.action.ActionResult;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.action.ImageAction;
import net.boyechko.image.batch.actions.PbrConventions.ChannelRule;
import net.boyechko.image.batch.actions.PbrConventions.Convention;
import net.boyechko.image.batch.image.ImageHandle;

/** Verifies texture channel values against the studio's PBR authoring conventions. */
public class VerifyPbrValuesAction implements ImageAction {
    public static final String ID = "verify_pbr_values";

    private final Supplier<PbrConventions> source;
    private PbrConventions conventions;

    /** Uses {@link PbrConventions#loadDefault()}, loaded when the first file is checked. */
    public VerifyPbrValuesAction() {
        this(PbrConventions::loadDefault);
    }

    public VerifyPbrValuesAction(PbrConventions conventions) {
        this(() -> conventions);
    }

    private VerifyPbrValuesAction(Supplier<PbrConventions> source) {
        this.source = source;
    }

    /**
     * Returns the convention set, loading it on first use. A set that fails to load is retried on
     * the next call, so every file reports the problem.
     */
    synchronized PbrConventions conventions() {
        if (conventions == null) {
            conventions = source.get();
        }
        return conventions;
    }

    @Override
    public ActionResult execute(ImageHandle handle) throws Exception {
        String fileName = handle.path().getFileName().toString();
        List<Convention> applicable = conventions().matching(fileName);
        if (applicable.isEmpty()) {
            return ActionResult.pass("No PBR convention applies to " + fileName);
        }

        BufferedImage image = handle.image();
        ActionStatus worst = ActionStatus.PASS;
        List<String> findings = new ArrayList<>();

        for (Convention convention : applicable) {
            for (ChannelRule rule : convention.channels) {
                if (rule.isAlpha() && !image.getColorModel().hasAlpha()) {
                    findings.add(
                            "image has no alpha channel to check "
                                    + rule.displayLabel()
                                    + " values");
                    worst = worse(worst, ActionStatus.WARN);
                    continue;
                }
                long bad = countViolations(image, rule);
                if (bad == 0) {
                    continue;
                }
                long total = (long) image.getWidth() * image.getHeight();
                findings.add(
                        percentage(bad, total)
                                + " of the pixels in the "
                                + rule.channel.toLowerCase(Locale.ROOT)
                                + " channel are not valid "
                                + rule.displayLabel()
                                + " values");
                worst = worse(worst, rule.isWarning() ? ActionStatus.WARN : ActionStatus.FAIL);
            }
        }

        if (findings.isEmpty()) {
            return ActionResult.pass("Passed all PBR validation tests");
        }
        return new ActionResult(worst, String.join("; ", findings), false);
    }

    static long countViolations(BufferedImage image, ChannelRule rule) {
        if (image.getColorModel().getColorSpace().getType() != ColorSpace.TYPE_RGB) {
            return countSampleViolations(image, rule);
        }
        int shift = rule.shift();
        int width = image.getWidth();
        int[] row = new int[width];
        long bad = 0;
        for (int y = 0; y < image.getHeight(); y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int argb : row) {
                if (!rule.accepts((argb >>> shift) & 0xFF)) {
                    bad++;
                }
            }
        }
        return bad;
    }

    /**
     * Checks raw samples of a non-RGB raster, such as grayscale, where {@code getRGB} would convert
     * values to sRGB. Color rules read the first band; alpha reads the last.
     */
    private static long countSampleViolations(BufferedImage image, ChannelRule rule) {
        Raster raster = image.getRaster();
        int band = rule.isAlpha() ? raster.getNumBands() - 1 : 0;
        int downshift = Math.max(0, raster.getSampleModel().getSampleSize(band) - 8);
        int width = raster.getWidth();
        int[] row = new int[width];
        long bad = 0;
        for (int y = 0; y < raster.getHeight(); y++) {
            raster.getSamples(0, y, width, 1, band, row);
            for (int sample : row) {
                if (!rule.accepts((sample >>> downshift) & 0xFF)) {
                    bad++;
                }
            }
        }
        return bad;
    }

    static String percentage(long part, long total) {
        String rounded = String.format(Locale.ROOT, "%.0f", part * 100.0 / total);
        return "0".equals(rounded) ? "less than 1%" : rounded + "%";
    }

    private static ActionStatus worse(ActionStatus a, ActionStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
