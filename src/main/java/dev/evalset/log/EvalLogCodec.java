package dev.evalset.log;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonToken;
import dev.evalset.EvalSetUtils;
import dev.evalset.json.EvalSetJsonMapper;
import dev.evalset.model.ModelRef;
import dev.evalset.task.TaskIdentity;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Reads and writes the json log format: a single object whose {@code header} field comes first,
 * followed by the {@code samples} array. Keeping the header first lets scans stop reading as soon
 * as it is parsed, which also makes partially written files readable.
 */
public final class EvalLogCodec {
    public static final String EXTENSION = ".json";

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private static final int MAX_NAME_SLUG = 48;

    @JsonPropertyOrder({"header", "samples"})
    record LogFile(EvalLogHeader header, List<SampleOutcome> samples) {}

    private EvalLogCodec() {}

    public static byte[] encode(EvalLogHeader header, List<SampleOutcome> samples) {
        try {
            return EvalSetJsonMapper.get().writeValueAsBytes(new LogFile(header, samples));
        } catch (IOException e) {
            throw new LogStoreException("failed to encode log for " + header.key(), e);
        }
    }

    /** Parse only the header, never touching the samples. */
    public static EvalLogHeader decodeHeader(InputStream in) throws IOException {
        var mapper = EvalSetJsonMapper.get();
        try (var parser = mapper.createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("log is not a json object");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                var field = parser.currentName();
                parser.nextToken();
                if ("header".equals(field)) {
                    return mapper.readValue(parser, EvalLogHeader.class);
                }
                parser.skipChildren();
            }
            throw new IOException("log has no header");
        }
    }

    public static EvalLog decode(String location, InputStream in) throws IOException {
        var file = EvalSetJsonMapper.get().readValue(in, LogFile.class);
        if (file.header() == null) {
            throw new IOException("log has no header");
        }
        return new EvalLog(
                location, file.header(), file.samples() == null ? List.of() : file.samples());
    }

    /**
     * File name of a log: {@code <timestamp>_<task>_<identity hash>_<model>_<sequence>-<attempt>}.
     * Identity, model, sequence and attempt make names from concurrent writers disjoint.
     */
    public static String fileName(
            TaskIdentity identity, ModelRef model, int sequence, int attempt, Instant created) {
        var taskSlug = EvalSetUtils.slug(identity.name());
        if (taskSlug.length() > MAX_NAME_SLUG) {
            taskSlug = taskSlug.substring(0, MAX_NAME_SLUG);
        }
        return "%s_%s_%s_%s_%03d-%d%s"
                .formatted(
                        FILE_TIMESTAMP.format(created),
                        taskSlug,
                        identity.hash(),
                        EvalSetUtils.slug(model.id()),
                        sequence,
                        attempt,
                        EXTENSION);
    }
}
