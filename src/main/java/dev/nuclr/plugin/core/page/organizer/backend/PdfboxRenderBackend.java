package dev.nuclr.plugin.core.page.organizer.backend;

import dev.nuclr.plugin.core.page.organizer.PageHandle;
import dev.nuclr.plugin.core.page.organizer.ThumbnailSize;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;

/**
 * Thumbnail backend using Apache PDFBox 3.x.
 */
@Slf4j
public class PdfboxRenderBackend implements PageRenderBackend {

    @Override
    public String name() {
        return "PDFBox";
    }

    @Override
    public BufferedImage render(PageHandle page, ThumbnailSize size) throws Exception {
        int pageIndex = page.pageIndex();
        return page.source().withDocument(document -> {
            PDPage pdPage = document.getPage(pageIndex);
            PDRectangle box = pdPage.getCropBox();

            // PDFRenderer applies /Rotate, so a quarter turn swaps the visible sides
            int rotation = Math.floorMod(pdPage.getRotation(), 360);
            boolean sideways = rotation == 90 || rotation == 270;
            float width  = sideways ? box.getHeight() : box.getWidth();
            float height = sideways ? box.getWidth()  : box.getHeight();

            float scale = size.scaleToFit(width, height);
            log.debug("PDFBox: rendering page {} of '{}' at scale {}", pageIndex, page.source().label(), scale);

            PDFRenderer renderer = new PDFRenderer(document);
            renderer.setSubsamplingAllowed(true);
            return renderer.renderImage(pageIndex, scale, ImageType.RGB);
        });
    }
}
