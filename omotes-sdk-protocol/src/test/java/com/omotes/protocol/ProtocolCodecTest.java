package com.omotes.protocol;

import com.omotes.protocol.job.JobCancel;
import com.omotes.protocol.job.JobProgressUpdate;
import com.omotes.protocol.job.JobResult;
import com.omotes.protocol.job.JobSubmission;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProtocolCodecTest {

    @Test
    void decode_jobSubmission_keepsEsdlAndWidensNumbersToDouble() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("iterations", 3);
        params.put("label", "abc");
        params.put("enabled", true);
        JobSubmission submission = new JobSubmission("f1b7c1de-0d3a-4c4f-9e1c-1c3b6f1e2a10", 60_000L, "grow_optimizer",
                "<esdl/>".getBytes(StandardCharsets.UTF_8), params);

        JobSubmission decoded = ProtocolCodec.decode(ProtocolCodec.encode(submission), JobSubmission.class);

        assertEquals(submission, decoded);
        assertEquals(3.0, decoded.getParams().get("iterations"));
        assertEquals("abc", decoded.getParams().get("label"));
        assertEquals(Boolean.TRUE, decoded.getParams().get("enabled"));
        assertArrayEquals("<esdl/>".getBytes(StandardCharsets.UTF_8), decoded.getEsdl());
    }

    @Test
    void decode_jobSubmissionWithoutTimeout_keepsTimeoutAbsent() {
        JobSubmission submission = new JobSubmission("id-1", null, "grow_simulator", new byte[0], Map.of());

        byte[] wire = ProtocolCodec.encode(submission);
        JobSubmission decoded = ProtocolCodec.decode(wire, JobSubmission.class);

        assertNull(decoded.getTimeoutMs());
        assertTrue(!new String(wire, StandardCharsets.UTF_8).contains("timeout_ms"));
    }

    @Test
    void decode_emptyBytes_throwsProtocolException() {
        assertThrows(ProtocolException.class, () -> ProtocolCodec.decode(new byte[0], JobCancel.class));
        assertThrows(ProtocolException.class, () -> ProtocolCodec.decode(null, JobCancel.class));
    }

    @Test
    void decode_garbage_throwsProtocolException() {
        byte[] garbage = "not a message".getBytes(StandardCharsets.UTF_8);

        ProtocolException e = assertThrows(ProtocolException.class, () -> ProtocolCodec.decode(garbage, JobResult.class));
        assertTrue(e.getMessage().contains("JobResult"));
    }

    @Test
    void decode_progressOutsideUnitInterval_throwsProtocolException() {
        byte[] wire = "{\"job_id\":\"j\",\"progress\":1.5,\"message\":\"too far\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(ProtocolException.class, () -> ProtocolCodec.decode(wire, JobProgressUpdate.class));
    }

    @Test
    void decode_unknownFields_areIgnored() {
        byte[] wire = "{\"uuid\":\"abc\",\"reason\":\"user\"}".getBytes(StandardCharsets.UTF_8);

        assertEquals(new JobCancel("abc"), ProtocolCodec.decode(wire, JobCancel.class));
    }

    @Test
    void jobSubmission_rejectsNestedParameterValues() {
        Map<String, Object> params = Map.of("nested", Map.of("a", 1));

        assertThrows(ProtocolException.class,
                () -> new JobSubmission("id", null, "grow_optimizer", new byte[0], params));
    }
}
