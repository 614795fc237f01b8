package com.configkit.ini.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.diff.DocumentDiff;
import com.configkit.ini.diff.MergeResult;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link DocumentDiff}, and optionally the result of merging it, as a plain-text report.
 */
public class DiffReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(DiffReportRenderer.class);

    static final String TEMPLATE_NAME = "diff-report.ftl";

    private final Configuration freemarkerConfig;

    public DiffReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(String leftName, String rightName, DocumentDiff diff) {
        return render(leftName, rightName, diff, null);
    }

    /**
     * @param mergeResult counts of an applied merge, or {@code null} for a compare-only report
     */
    public String render(String leftName, String rightName, DocumentDiff diff, MergeResult mergeResult) {
        Map<String, Object> model = new HashMap<>();
        model.put("leftName", leftName);
        model.put("rightName", rightName);
        model.put("diff", diff);
        model.put("hasChanges", diff.hasChanges());
        if (mergeResult != null) {
            model.put("mergeResult", mergeResult);
        }

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            log.error("Failed to render {}: {}", TEMPLATE_NAME, e.getMessage());
            throw new IllegalStateException("Failed to render diff report", e);
        }
    }
}
