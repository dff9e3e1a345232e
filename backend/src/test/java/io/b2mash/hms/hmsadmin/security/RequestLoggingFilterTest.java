package io.b2mash.hms.hmsadmin.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestLoggingFilterTest {

  private final RequestLoggingFilter filter = new RequestLoggingFilter();

  @Test
  void tenantSegment_extractsTenantFromTenantAndUsagePaths() {
    assertThat(RequestLoggingFilter.tenantSegment("/internal/tenants/T-4")).isEqualTo("T-4");
    assertThat(RequestLoggingFilter.tenantSegment("/internal/tenants/T-4/suspend"))
        .isEqualTo("T-4");
    assertThat(RequestLoggingFilter.tenantSegment("/internal/usage/tenants/T-9/rooms/increment"))
        .isEqualTo("T-9");
  }

  @Test
  void tenantSegment_ignoresStatsAndNonTenantPaths() {
    assertThat(RequestLoggingFilter.tenantSegment("/internal/tenants/stats")).isNull();
    assertThat(RequestLoggingFilter.tenantSegment("/internal/tenants")).isNull();
    assertThat(RequestLoggingFilter.tenantSegment("/internal/feature-flags/x")).isNull();
    assertThat(RequestLoggingFilter.tenantSegment(null)).isNull();
  }

  @Test
  void doFilterInternal_bindsMdcDuringRequestAndClearsAfter() throws Exception {
    var request = new MockHttpServletRequest("GET", "/internal/tenants/T-2");
    var seenRequestId = new AtomicReference<String>();
    var seenTenant = new AtomicReference<String>();

    filter.doFilterInternal(
        request,
        new MockHttpServletResponse(),
        (req, res) -> {
          seenRequestId.set(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID));
          seenTenant.set(MDC.get(RequestLoggingFilter.MDC_TENANT_ID));
        });

    assertThat(seenRequestId.get()).isNotBlank();
    assertThat(seenTenant.get()).isEqualTo("T-2");
    assertThat(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID)).isNull();
    assertThat(MDC.get(RequestLoggingFilter.MDC_TENANT_ID)).isNull();
  }
}
