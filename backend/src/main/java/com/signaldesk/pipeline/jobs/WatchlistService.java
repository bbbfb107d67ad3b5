package com.signaldesk.pipeline.jobs;

import com.signaldesk.pipeline.config.PipelineProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class WatchlistService {
    private static final Logger log = LoggerFactory.getLogger(WatchlistService.class);

    private final PipelineProperties properties;
    private final ResourceLoader resourceLoader;

    public WatchlistService(PipelineProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    public List<String> tickers() {
        String override = properties.getWatchlist().getTickers();
        if (override != null && !override.isBlank()) {
            return normalize(Arrays.asList(override.split(",")));
        }
        return loadCsv(properties.getWatchlist().getCsv());
    }

    List<String> loadCsv(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Watchlist CSV not found at {}", location);
            return List.of();
        }
        Set<String> tickers = new LinkedHashSet<>();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String ticker = getColumn(record, "ticker", "symbol");
                if (ticker == null) {
                    log.debug("Watchlist row {} has no ticker", record.getRecordNumber());
                    continue;
                }
                tickers.add(ticker);
            }
        } catch (IOException e) {
            log.warn("Failed to read watchlist CSV at {}", location, e);
            return List.of();
        }
        return normalize(tickers);
    }

    private List<String> normalize(Iterable<String> raw) {
        Set<String> tickers = new LinkedHashSet<>();
        for (String value : raw) {
            if (value == null) {
                continue;
            }
            String ticker = value.trim().toUpperCase(Locale.ROOT);
            if (!ticker.isEmpty()) {
                tickers.add(ticker);
            }
        }
        return List.copyOf(tickers);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header != null && header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }
}
