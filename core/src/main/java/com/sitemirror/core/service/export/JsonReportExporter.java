package com.sitemirror.core.service.export;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitemirror.core.api.PageStore;
import com.sitemirror.core.model.Report;

import java.io.IOException;
import java.util.Objects;

/**
 * report.json Exporter (Jackson, pretty-print).
 * {totalDiscovered, totalDownloaded, totalFailed, pages:[{url,localPath,title,status}], failedUrls:[{url,error}]}
 */
public class JsonReportExporter {

    public static final String FILE_NAME = "report.json";

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public byte[] toJson(Report report) throws IOException {
        Objects.requireNonNull(report, "report");
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
    }

    /** @return 저장 키 */
    public String export(Report report, PageStore store) throws IOException {
        store.put(FILE_NAME, toJson(report));
        return FILE_NAME;
    }
}
