package com.lnradar.donation;

import com.lnradar.domain.PayLink;
import com.lnradar.domain.WalletDescriptor;
import com.lnradar.ingestion.adapter.UpstreamException;
import com.lnradar.ingestion.adapter.WalletApiClient;
import com.lnradar.ingestion.wallet.WalletRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PayLinkResolverTest {

    @Mock
    private WalletApiClient client;
    @Mock
    private WalletRegistry walletRegistry;

    @InjectMocks
    private PayLinkResolver resolver;

    @Test
    @DisplayName("finds the link by id using the main wallet credential")
    void resolves() {
        when(walletRegistry.main()).thenReturn(new WalletDescriptor("main", "Main", "main-key"));
        when(client.fetchPayLinks("main-key")).thenReturn(List.of(
                new PayLink("OTHER", "x", "x", "x"),
                new PayLink("LINK1", "Tips", "tips", "LNURL1")));

        assertThat(resolver.resolve("LINK1")).map(PayLink::username).contains("tips");
        assertThat(resolver.resolve("NOPE")).isEmpty();
    }

    @Test
    @DisplayName("upstream failure resolves to empty")
    void upstreamFailure() {
        when(walletRegistry.main()).thenReturn(new WalletDescriptor("main", "Main", "main-key"));
        when(client.fetchPayLinks("main-key")).thenThrow(new UpstreamException("down"));

        assertThat(resolver.resolve("LINK1")).isEmpty();
    }

    @Test
    @DisplayName("blank id is never resolved")
    void blankId() {
        assertThat(resolver.resolve(" ")).isEmpty();
    }
}
