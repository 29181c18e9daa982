package com.phonepe.memsight.embedding;

import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.DestroyMode;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;

import java.util.List;
import java.util.Objects;

/**
 * Sentence-transformer embeddings computed locally through DJL. The model is downloaded on first use.
 * Check <a href="https://docs.djl.ai/master/docs/load_model.html">DJL model loading</a> for supported urls.
 */
@Slf4j
public class HuggingfaceEmbeddingModel implements EmbeddingModel {
    public static final String DEFAULT_MODEL_URL
            = "djl://ai.djl.huggingface.pytorch/sentence-transformers/all-MiniLM-L6-v2";
    public static final int DEFAULT_DIMENSIONS = 384;
    private static final int MAX_INPUT_CHARS = 10_000;
    private static final int DEFAULT_POOL_SIZE = 4;

    @Getter
    private final String modelUrl;
    private final int maxInputChars;
    private final ZooModel<String, float[]> zooModel;
    // Predictors are not thread safe
    private final GenericObjectPool<Predictor<String, float[]>> predictors;

    public HuggingfaceEmbeddingModel() {
        this(null, MAX_INPUT_CHARS, DEFAULT_POOL_SIZE);
    }

    @Builder
    @SneakyThrows
    public HuggingfaceEmbeddingModel(String modelUrl, int maxInputChars, int poolSize) {
        this.modelUrl = Objects.requireNonNullElse(modelUrl, DEFAULT_MODEL_URL);
        this.maxInputChars = maxInputChars > 0 ? maxInputChars : MAX_INPUT_CHARS;
        System.setProperty("OPT_OUT_TRACKING", "true");

        final var criteria = Criteria.builder()
                .setTypes(String.class, float[].class)
                .optModelUrls(this.modelUrl)
                .optEngine("PyTorch")
                .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                .optProgress(new ProgressBar())
                .build();

        this.zooModel = criteria.loadModel();
        final var poolConfig = new GenericObjectPoolConfig<Predictor<String, float[]>>();
        poolConfig.setMaxTotal(poolSize > 0 ? poolSize : DEFAULT_POOL_SIZE);
        this.predictors = new GenericObjectPool<>(new PredictorFactory(zooModel), poolConfig);
        log.info("Loaded embedding model {}", this.modelUrl);
    }

    @Override
    @SneakyThrows
    public float[] getEmbedding(String input) {
        final var predictor = predictors.borrowObject();
        try {
            return predictor.predict(truncate(input));
        }
        finally {
            predictors.returnObject(predictor);
        }
    }

    @Override
    @SneakyThrows
    public List<float[]> getEmbeddings(List<String> inputs) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        final var predictor = predictors.borrowObject();
        try {
            return predictor.batchPredict(inputs.stream().map(this::truncate).toList());
        }
        finally {
            predictors.returnObject(predictor);
        }
    }

    @Override
    public void close() {
        predictors.close();
        zooModel.close();
    }

    private String truncate(String input) {
        final var text = Objects.requireNonNullElse(input, "");
        return text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
    }

    @RequiredArgsConstructor
    private static final class PredictorFactory extends BasePooledObjectFactory<Predictor<String, float[]>> {

        private final ZooModel<String, float[]> zooModel;

        @Override
        public Predictor<String, float[]> create() {
            log.debug("Creating new predictor");
            return zooModel.newPredictor();
        }

        @Override
        public PooledObject<Predictor<String, float[]>> wrap(Predictor<String, float[]> predictor) {
            return new DefaultPooledObject<>(predictor);
        }

        @Override
        public void destroyObject(PooledObject<Predictor<String, float[]>> predictor, DestroyMode destroyMode) {
            log.info("Closing predictor");
            predictor.getObject().close();
        }
    }
}
