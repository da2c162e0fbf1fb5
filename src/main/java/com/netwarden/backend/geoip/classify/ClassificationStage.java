package com.netwarden.backend.geoip.classify;

import java.util.Optional;

/** 分類階段：有把握就回結果，沒有就 empty 交給下一階段 */
public interface ClassificationStage {

    Optional<Classification> classify(ClassificationInput input);
}
