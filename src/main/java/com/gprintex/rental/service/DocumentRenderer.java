package com.gprintex.rental.service;

import com.gprintex.rental.domain.ContractPipelineException;
import com.gprintex.rental.domain.PipelineErrorCode;
import com.gprintex.rental.domain.RenderedDocument;
import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.util.regex.Pattern;

/**
 * Renders generated contract markup to PDF.
 * <p>
 * jsoup normalizes the markup into a well-formed DOM before OpenHTMLtoPDF lays it out.
 */
@Service
public class DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(DocumentRenderer.class);

    // Opening fence with optional language tag, body up to the closing fence or end of text.
    private static final Pattern FENCED_BLOCK = Pattern.compile("```[a-zA-Z]*[ \\t]*\\R?(.*?)(?:```|\\z)", Pattern.DOTALL);

    /**
     * @throws ContractPipelineException with RENDER_FAILED when the markup is empty or the engine fails
     */
    public RenderedDocument render(String markup) {
        var html = stripCodeFence(markup);
        if (html.isBlank()) {
            throw new ContractPipelineException(PipelineErrorCode.RENDER_FAILED, "Contract markup is empty");
        }

        try (var out = new ByteArrayOutputStream()) {
            var parsed = Jsoup.parse(html);
            var builder = new PdfRendererBuilder();
            builder.useFastMode();
            builder.withW3cDocument(new W3CDom().fromJsoup(parsed), "/");
            builder.toStream(out);
            builder.run();

            var bytes = out.toByteArray();
            if (bytes.length == 0) {
                throw new ContractPipelineException(PipelineErrorCode.RENDER_FAILED, "Renderer produced no output");
            }
            var document = RenderedDocument.of(bytes);
            log.info("Rendered contract PDF: {} bytes, sha256={}", document.size(), document.digest());
            return document;
        } catch (ContractPipelineException e) {
            throw e;
        } catch (Exception e) {
            log.error("PDF rendering failed", e);
            throw new ContractPipelineException(PipelineErrorCode.RENDER_FAILED, "PDF rendering failed: " + e.getMessage(), e);
        }
    }

    /**
     * Generators often wrap markup in a Markdown code fence, sometimes with prose around it.
     * When a fence is present only the first fenced block is kept.
     */
    static String stripCodeFence(String markup) {
        if (markup == null) {
            return "";
        }
        var fenced = FENCED_BLOCK.matcher(markup);
        return fenced.find() ? fenced.group(1).trim() : markup.trim();
    }
}
