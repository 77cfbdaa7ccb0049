package dev.nuclr.plugin.core.page.organizer.backend;

import dev.nuclr.plugin.core.page.organizer.SourceDocument;
import dev.nuclr.plugin.core.page.organizer.SourceOpenException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens PDF files with Apache PDFBox 3.x.
 */
@Slf4j
public class PdfboxDocumentSource implements DocumentSource {

    @Override
    public SourceDocument open(Path file) throws SourceOpenException {
        byte[] pdfBytes;
        try {
            pdfBytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new SourceOpenException(file, "Cannot read " + file.getFileName() + ": " + e.getMessage(), e);
        }

        PDDocument document;
        try {
            document = Loader.loadPDF(pdfBytes);
        } catch (InvalidPasswordException e) {
            throw new EncryptedSourceException(file);
        } catch (IOException e) {
            throw new SourceOpenException(file, "Not a valid PDF: " + file.getFileName(), e);
        }

        SourceDocument source = new SourceDocument(labelOf(file), document);
        log.info("Opened PDF via PDFBox: '{}', {} pages, PDF {}",
                source.label(), source.pageCount(), document.getVersion());
        return source;
    }

    /** File name without its extension. */
    static String labelOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
