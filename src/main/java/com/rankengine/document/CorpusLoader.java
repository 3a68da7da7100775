package com.rankengine.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 从JSON文件加载语料。
 *
 * 文件内容为对象数组，每个对象是一篇文档，数组下标即docId。
 * 标量字段按文本保存；null、数组与嵌套对象被忽略。
 */
public final class CorpusLoader {
    private static final Logger logger = LoggerFactory.getLogger(CorpusLoader.class);

    private final ObjectMapper mapper;

    public CorpusLoader() {
        this(new ObjectMapper());
    }

    public CorpusLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public InMemoryCorpus load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("语料文件不存在: " + path);
        }
        JsonNode root = mapper.readTree(path.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("语料文件必须是JSON数组: " + path);
        }

        InMemoryCorpus corpus = new InMemoryCorpus();
        int docId = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new IOException("第 " + docId + " 个元素不是JSON对象: " + path);
            }
            corpus.addDocument(new Document(docId, readFields(node)));
            docId++;
        }
        logger.info("已加载语料: {} ({} 篇文档)", path, corpus.size());
        return corpus;
    }

    private Map<String, String> readFields(JsonNode node) {
        Map<String, String> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getValue().isValueNode() && !entry.getValue().isNull()) {
                fields.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return fields;
    }
}
