package com.tony.footValue.service;

import com.opencsv.bean.CsvToBeanBuilder;
import com.opencsv.bean.StatefulBeanToCsv;
import com.opencsv.bean.StatefulBeanToCsvBuilder;
import com.opencsv.exceptions.CsvDataTypeMismatchException;
import com.opencsv.exceptions.CsvRequiredFieldEmptyException;
import com.tony.footValue.model.dto.MatchFeatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Export / relecture CSV du jeu de features, consommé par le pipeline d'entraînement externe.
 */
@Service
@Slf4j
public class FeatureExportService {

    public void exportCsv(List<MatchFeatures> rows, Writer writer) {
        StatefulBeanToCsv<MatchFeatures> csv = new StatefulBeanToCsvBuilder<MatchFeatures>(writer)
                .withSeparator(',')
                .withApplyQuotesToAll(false)
                .build();
        try {
            csv.write(rows);
            writer.flush();
        } catch (CsvDataTypeMismatchException | CsvRequiredFieldEmptyException e) {
            throw new IllegalStateException("Export CSV impossible : " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.info("💾 Export CSV : {} lignes de features", rows.size());
    }

    public List<MatchFeatures> readCsv(Reader reader) {
        return new CsvToBeanBuilder<MatchFeatures>(reader)
                .withType(MatchFeatures.class)
                .withSeparator(',')
                .withIgnoreLeadingWhiteSpace(true)
                .build()
                .parse();
    }
}
