package com.example.flowerclassifier.service;

import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.response.HeatmapDataPoint;
import com.example.flowerclassifier.model.response.HeatmapResponse;
import com.example.flowerclassifier.repository.ClassificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class HeatmapService {

    private static final Logger log = LoggerFactory.getLogger(HeatmapService.class);

    private final ClassificationRepository repository;

    public HeatmapService(ClassificationRepository repository) {
        this.repository = repository;
    }

    /**
     * Every geotagged record becomes a data point. {@code total_records}
     * counts all stored records, including those without a location.
     */
    public HeatmapResponse buildHeatmap() {
        List<ClassificationRecord> records = repository.findAllWithoutImages();
        List<HeatmapDataPoint> points = records.stream()
                .filter(ClassificationRecord::hasLocation)
                .map(HeatmapDataPoint::from)
                .collect(Collectors.toList());
        log.debug("Heatmap built from {} records, {} geotagged", records.size(), points.size());
        return new HeatmapResponse(records.size(), points);
    }
}
