package dev.simpleemailapi.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EmailApiErrorsTest {

    @Test
    void parseNullReturnsNull() {
        assertThat(EmailApiErrors.parse(null)).isNull();
    }

    @Test
    void plainErrorIsWrappedAsUnspecified() {
        EmailApiException err = EmailApiErrors.parse(new IOException("connection reset"));

        assertThat(err.code()).isEqualTo(ErrorCodes.UNSPECIFIED);
        assertThat(err.getMessage()).isEqualTo("connection reset");
        assertThat(err.rpcCode()).isEqualTo(RpcCode.UNKNOWN);
        assertThat(err.field()).isEmpty();
        assertThat(err.metadata()).isEmpty();
    }

    @Test
    void rpcErrorWithoutDetailKeepsTransportMessageAndCode() {
        EmailApiException err = EmailApiErrors.parse(new RpcException(RpcCode.UNAVAILABLE, "upstream down"));

        assertThat(err.code()).isEqualTo(ErrorCodes.UNSPECIFIED);
        assertThat(err.getMessage()).isEqualTo("upstream down");
        assertThat(err.rpcCode()).isEqualTo(RpcCode.UNAVAILABLE);
    }

    @Test
    void errorDetailSuppliesCodeFieldAndMetadata() {
        ErrorDetailPayload payload = new ErrorDetailPayload(
                ErrorCodes.DOMAIN_NOT_VERIFIED, "domain example.com is not verified", "from",
                Map.of("domain", "example.com"));
        RpcException rpc = new RpcException(RpcCode.FAILED_PRECONDITION, "failed precondition",
                List.of(new ErrorDetail(Protocol.ERROR_DETAIL_TYPE, Optional.of(payload))));

        EmailApiException err = EmailApiErrors.parse(rpc);

        assertThat(err.code()).isEqualTo(501);
        assertThat(err.is(ErrorCodes.DOMAIN_NOT_VERIFIED)).isTrue();
        assertThat(err.getMessage()).isEqualTo("domain example.com is not verified");
        assertThat(err.field()).isEqualTo("from");
        assertThat(err.metadata()).containsEntry("domain", "example.com");
        assertThat(err.rpcCode()).isEqualTo(RpcCode.FAILED_PRECONDITION);
        assertThat(err.isCategory("domain")).isTrue();
        assertThat(err.isCategory("validation")).isFalse();
    }

    @Test
    void emptyDetailMessageDoesNotOverrideTransportMessage() {
        ErrorDetailPayload payload = new ErrorDetailPayload(ErrorCodes.RATE_LIMITED, "", "", null);
        RpcException rpc = new RpcException(RpcCode.RESOURCE_EXHAUSTED, "slow down",
                List.of(new ErrorDetail(Protocol.ERROR_DETAIL_TYPE, Optional.of(payload))));

        EmailApiException err = EmailApiErrors.parse(rpc);

        assertThat(err.getMessage()).isEqualTo("slow down");
        assertThat(err.metadata()).isEmpty();
        assertThat(err.isCategory(ErrorCategory.RATE_LIMIT)).isTrue();
    }

    @Test
    void undecodableAndForeignDetailsAreSkipped() {
        ErrorDetailPayload payload = new ErrorDetailPayload(ErrorCodes.NOT_FOUND, "missing", "", Map.of());
        RpcException rpc = new RpcException(RpcCode.NOT_FOUND, "not found", List.of(
                new ErrorDetail("google.rpc.RetryInfo", Optional.empty()),
                new ErrorDetail(Protocol.ERROR_DETAIL_TYPE, Optional.empty()),
                new ErrorDetail(Protocol.ERROR_DETAIL_TYPE, Optional.of(payload))));

        EmailApiException err = EmailApiErrors.parse(rpc);

        assertThat(err.code()).isEqualTo(ErrorCodes.NOT_FOUND);
        assertThat(err.isCategory("notfound")).isTrue();
    }

    @Test
    void parseFindsRpcErrorInCauseChain() {
        RpcException rpc = new RpcException(RpcCode.UNAUTHENTICATED, "bad key", List.of(
                new ErrorDetail(Protocol.ERROR_DETAIL_TYPE,
                        Optional.of(new ErrorDetailPayload(ErrorCodes.INVALID_API_KEY, "invalid key", "", Map.of())))));

        EmailApiException err = EmailApiErrors.parse(new IllegalStateException("wrapped", rpc));

        assertThat(err.is(ErrorCodes.INVALID_API_KEY)).isTrue();
        assertThat(err.isCategory("auth")).isTrue();
    }

    @Test
    void parseReturnsExistingStructuredError() {
        EmailApiException original = new EmailApiException(ErrorCodes.INTERNAL, "boom", "", Map.of(), RpcCode.INTERNAL);

        assertThat(EmailApiErrors.parse(original)).isSameAs(original);
    }

    @Test
    void isErrorChecksCauseChain() {
        EmailApiException structured = new EmailApiException(ErrorCodes.INTERNAL, "boom", "", Map.of(), RpcCode.INTERNAL);

        assertThat(EmailApiErrors.isError(null)).isFalse();
        assertThat(EmailApiErrors.isError(new RuntimeException("x"))).isFalse();
        assertThat(EmailApiErrors.isError(new RpcException(RpcCode.INTERNAL, "x"))).isFalse();
        assertThat(EmailApiErrors.isError(structured)).isTrue();
        assertThat(EmailApiErrors.isError(new RuntimeException("outer", structured))).isTrue();
    }

    @Test
    void nullMetadataValuesAreDropped() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("limit", "100");
        metadata.put("upgradeUrl", null);
        ErrorDetailPayload payload = new ErrorDetailPayload(ErrorCodes.RATE_LIMITED, "rate limit exceeded", "", metadata);
        RpcException rpc = new RpcException(RpcCode.RESOURCE_EXHAUSTED, "resource exhausted",
                List.of(new ErrorDetail(Protocol.ERROR_DETAIL_TYPE, Optional.of(payload))));

        EmailApiException err = EmailApiErrors.parse(rpc);

        assertThat(err.is(ErrorCodes.RATE_LIMITED)).isTrue();
        assertThat(err.metadata()).containsExactly(Map.entry("limit", "100"));
    }
}
