package dev.simpleemailapi.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCategoryTest {

    @Test
    void rangesAreHalfOpen() {
        assertThat(ErrorCategory.AUTH.contains(100)).isTrue();
        assertThat(ErrorCategory.AUTH.contains(199)).isTrue();
        assertThat(ErrorCategory.AUTH.contains(200)).isFalse();
        assertThat(ErrorCategory.AUTHZ.contains(200)).isTrue();
        assertThat(ErrorCategory.NOT_FOUND.contains(409)).isTrue();
        assertThat(ErrorCategory.NOT_FOUND.contains(410)).isFalse();
        assertThat(ErrorCategory.INTERNAL.contains(899)).isFalse();
        assertThat(ErrorCategory.INTERNAL.contains(900)).isTrue();
        assertThat(ErrorCategory.INTERNAL.contains(Integer.MAX_VALUE)).isTrue();
    }

    @Test
    void unmappedGapsBelongToNoCategory() {
        EmailApiException gap = error(450);
        EmailApiException attachment = error(ErrorCodes.ATTACHMENT_TOO_LARGE);
        EmailApiException alreadyExists = error(ErrorCodes.DOMAIN_ALREADY_EXISTS);

        for (ErrorCategory category : ErrorCategory.values()) {
            assertThat(gap.isCategory(category)).as(category.name()).isFalse();
            assertThat(gap.isCategory(category.categoryName())).as(category.categoryName()).isFalse();
            assertThat(attachment.isCategory(category)).isFalse();
            assertThat(alreadyExists.isCategory(category)).isFalse();
        }
        assertThat(alreadyExists.is(ErrorCodes.DOMAIN_ALREADY_EXISTS)).isTrue();
    }

    @Test
    void unspecifiedCodeHasNoCategory() {
        EmailApiException err = error(ErrorCodes.UNSPECIFIED);

        for (ErrorCategory category : ErrorCategory.values()) {
            assertThat(err.isCategory(category)).isFalse();
        }
    }

    @Test
    void unknownCategoryNameIsFalse() {
        assertThat(error(ErrorCodes.INVALID_ARGUMENT).isCategory("bogus")).isFalse();
        assertThat(error(ErrorCodes.INVALID_ARGUMENT).isCategory((String) null)).isFalse();
        assertThat(ErrorCategory.fromName("ratelimit")).isEqualTo(ErrorCategory.RATE_LIMIT);
    }

    private static EmailApiException error(int code) {
        return new EmailApiException(code, "m", "", Map.of(), RpcCode.UNKNOWN);
    }
}
