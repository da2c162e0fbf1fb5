package com.netwarden.backend.geoip.classify;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 兩階段分類：registry → 關鍵字規則；都沒結果 → unknown。
 * stage 順序由 @Order 決定。
 */
@Component
public class ProviderClassifier {

    private final List<ClassificationStage> stages;

    public ProviderClassifier(List<ClassificationStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public Classification classify(ClassificationInput input) {
        for (ClassificationStage stage : stages) {
            Optional<Classification> c = stage.classify(input);
            if (c.isPresent()) return c.get();
        }
        return Classification.unknown();
    }
}
