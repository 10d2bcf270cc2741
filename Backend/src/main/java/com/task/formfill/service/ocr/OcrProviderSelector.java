package com.task.formfill.service.ocr;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Orders the recognition providers to try for one image. The cloud provider comes first when
 * dev mode is off and the payload fits under the size ceiling; the local recognizer is always last.
 */
@Component
public class OcrProviderSelector {

    private final Map<String, OcrProvider> providers;
    private final String cloudProvider;
    private final String localProvider;
    private final long cloudMaxBytes;
    private final boolean devMode;

    public OcrProviderSelector(
            List<OcrProvider> providers,
            @Value("${formfill.ocr.cloud-provider:textract}") String cloudProvider,
            @Value("${formfill.ocr.local-provider:tesseract}") String localProvider,
            @Value("${formfill.ocr.cloud-max-bytes:10485760}") long cloudMaxBytes,
            @Value("${formfill.ocr.dev-mode:false}") boolean devMode
    ) {
        this.providers = providers.stream()
                .collect(Collectors.toMap(OcrProvider::name, Function.identity(), (a, b) -> a));
        this.cloudProvider = cloudProvider;
        this.localProvider = localProvider;
        this.cloudMaxBytes = cloudMaxBytes;
        this.devMode = devMode;
    }

    public List<OcrProvider> select(long payloadBytes) {
        List<OcrProvider> ordered = new ArrayList<>();
        OcrProvider cloud = providers.get(cloudProvider);
        if (!devMode && cloud != null && payloadBytes < cloudMaxBytes) {
            ordered.add(cloud);
        }
        OcrProvider local = providers.get(localProvider);
        if (local != null && local != cloud) {
            ordered.add(local);
        }
        return ordered;
    }
}
