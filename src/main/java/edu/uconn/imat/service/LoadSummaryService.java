package edu.uconn.imat.service;

import edu.uconn.imat.repository.AnnotationRecordRepository;
import edu.uconn.imat.repository.ImageRecordRepository;
import edu.uconn.imat.repository.LabelMapRepository;
import edu.uconn.imat.repository.SplitInfoRepository;
import edu.uconn.imat.repository.SplitLicenseRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports what the raw tables hold for each split after a load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadSummaryService {

    private final LabelMapRepository labelMapRepository;

    private final ImageRecordRepository imageRecordRepository;

    private final AnnotationRecordRepository annotationRecordRepository;

    private final SplitInfoRepository splitInfoRepository;

    private final SplitLicenseRepository splitLicenseRepository;

    @Transactional(readOnly = true)
    public List<SplitSummary> summarize(List<String> splits) {
        log.info("label_map: {} rows", labelMapRepository.count());
        List<SplitSummary> summaries = new ArrayList<>();
        for (String split : splits) {
            SplitSummary summary = new SplitSummary(
                split,
                imageRecordRepository.countBySplit(split),
                annotationRecordRepository.countBySplit(split),
                splitInfoRepository.existsById(split),
                splitLicenseRepository.existsById(split));
            log.info("{}: {} images, {} annotations, info={}, license={}", split,
                summary.getImages(), summary.getAnnotations(), summary.isInfo(), summary.isLicense());
            summaries.add(summary);
        }
        return summaries;
    }

    @Value
    public static class SplitSummary {
        String split;
        long images;
        long annotations;
        boolean info;
        boolean license;
    }
}
