package com.jdc.foodgram.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdc.foodgram.domain.dto.ingredient.IngredientImportDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 재료 사전 일괄 등록. JSON([{"name", "measurement_unit"}]) 또는 CSV(name,unit) 파일을 읽고
 * 이미 있는 (이름, 단위) 쌍은 건너뛴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngredientImportService {

    public enum Format { JSON, CSV }

    private final IngredientRepository ingredientRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public int importFrom(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        Format format = fileName.endsWith(".csv") ? Format.CSV : Format.JSON;
        try (InputStream in = Files.newInputStream(path)) {
            return importFrom(in, format);
        } catch (IOException e) {
            throw new CustomException(ErrorCode.INGREDIENT_IMPORT_FAILED, "재료 파일을 읽을 수 없습니다: " + path);
        }
    }

    @Transactional
    public int importFrom(InputStream in, Format format) {
        List<IngredientImportDto> rows;
        try {
            rows = format == Format.CSV ? readCsv(in) : readJson(in);
        } catch (IOException e) {
            throw new CustomException(ErrorCode.INGREDIENT_IMPORT_FAILED, "재료 파일 형식이 올바르지 않습니다: " + e.getMessage());
        }
        return saveNew(rows);
    }

    int saveNew(List<IngredientImportDto> rows) {
        Set<String> known = new HashSet<>();
        ingredientRepository.findAll().forEach(i -> known.add(key(i.getName(), i.getMeasurementUnit())));

        List<Ingredient> toSave = new ArrayList<>();
        int skipped = 0;
        for (IngredientImportDto row : rows) {
            String name = row.getName() == null ? null : row.getName().trim();
            String unit = row.getMeasurementUnit() == null ? null : row.getMeasurementUnit().trim();
            if (!StringUtils.hasText(name) || !StringUtils.hasText(unit)) {
                skipped++;
                continue;
            }
            if (!known.add(key(name, unit))) {
                skipped++;
                continue;
            }
            toSave.add(Ingredient.builder().name(name).measurementUnit(unit).build());
        }

        ingredientRepository.saveAll(toSave);
        log.info("재료 일괄 등록: created={}, skipped={}", toSave.size(), skipped);
        return toSave.size();
    }

    private List<IngredientImportDto> readJson(InputStream in) throws IOException {
        return objectMapper.readValue(in, new TypeReference<List<IngredientImportDto>>() {});
    }

    private List<IngredientImportDto> readCsv(InputStream in) throws IOException {
        List<IngredientImportDto> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReaderBuilder(new InputStreamReader(in, StandardCharsets.UTF_8)).build()) {
            for (String[] row : reader.readAll()) {
                if (row.length < 2) {
                    if (row.length == 1 && StringUtils.hasText(row[0])) {
                        log.warn("CSV 형식이 아닌 줄을 건너뜀: {}", row[0]);
                    }
                    continue;
                }
                // 세 번째 이후 컬럼은 무시
                rows.add(new IngredientImportDto(row[0], row[1]));
            }
        } catch (CsvException e) {
            throw new IOException("CSV 파싱 실패: " + e.getMessage(), e);
        }
        return rows;
    }

    private static String key(String name, String unit) {
        return name + "\u0000" + unit;
    }
}
