package com.ewsaccount.service;

import com.ewsaccount.domain.Depth;
import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;
import com.ewsaccount.domain.Protocol;
import com.ewsaccount.domain.ProtocolConfig;
import com.ewsaccount.errors.TransportException;
import com.ewsaccount.transport.ExchangeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Folder tree discovery unit tests
 */
@ExtendWith(MockitoExtension.class)
class FolderTreeDiscovererTest {

    @Mock
    private ExchangeService exchangeService;

    private FolderTreeDiscoverer discoverer;
    private Account account;
    private Folder root;

    @BeforeEach
    void setUp() {
        discoverer = new FolderTreeDiscoverer(exchangeService);
        account = Account.builder()
                .primarySmtpAddress("user@example.com")
                .config(new ProtocolConfig(Protocol.builder().serviceEndpoint("https://ews").build()))
                .exchangeService(exchangeService)
                .build();
        root = Folder.builder().id("root").name("Root").type(FolderType.ROOT).build();
    }

    @Test
    @DisplayName("Top of Information Store: its children are the working set, no deep listing")
    void testTopOfInformationStore() {
        Folder shared = Folder.builder().id("sh").name("Shared Inbox").type(FolderType.INBOX).build();
        Folder store = Folder.builder().id("tois").name("Top of Information Store").build();
        Folder a = Folder.builder().id("a").name("Inbox").type(FolderType.INBOX).build();
        Folder b = Folder.builder().id("b").name("Projects").type(FolderType.OTHER).build();
        when(exchangeService.listChildFolders(account, root, Depth.SHALLOW)).thenReturn(List.of(shared, store));
        when(exchangeService.listChildFolders(account, store, Depth.SHALLOW)).thenReturn(List.of(a, b));

        FolderDirectory directory = discoverer.discover(account, root);

        assertThat(directory.get(FolderType.INBOX)).containsExactly(a);
        assertThat(directory.get(FolderType.OTHER)).containsExactly(b);
        verify(exchangeService, never()).listChildFolders(account, root, Depth.DEEP);
    }

    @Test
    @DisplayName("No Top of Information Store: deep listing is classified")
    void testDeepTraversal() {
        Folder top = Folder.builder().id("t").name("Inbox").type(FolderType.INBOX).build();
        Folder cal1 = Folder.builder().id("c1").name("Calendar").type(FolderType.CALENDAR).build();
        Folder nested = Folder.builder().id("n").name("Archive").type(FolderType.OTHER).build();
        Folder cal2 = Folder.builder().id("c2").name("Birthdays").type(FolderType.CALENDAR).build();
        when(exchangeService.listChildFolders(account, root, Depth.SHALLOW)).thenReturn(List.of(top));
        when(exchangeService.listChildFolders(account, root, Depth.DEEP))
                .thenReturn(List.of(top, cal1, nested, cal2));

        FolderDirectory directory = discoverer.discover(account, root);

        assertThat(directory.get(FolderType.INBOX)).containsExactly(top);
        assertThat(directory.get(FolderType.CALENDAR)).containsExactly(cal1, cal2);
        assertThat(directory.get(FolderType.OTHER)).containsExactly(nested);
        assertThat(directory.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Every folder type is a key, empty when nothing was found")
    void testEveryTypePresent() {
        when(exchangeService.listChildFolders(account, root, Depth.SHALLOW)).thenReturn(List.of());
        when(exchangeService.listChildFolders(account, root, Depth.DEEP)).thenReturn(List.of());

        FolderDirectory directory = discoverer.discover(account, root);

        assertThat(directory.asMap()).containsOnlyKeys(FolderType.values());
        assertThat(directory.asMap().values()).allMatch(List::isEmpty);
    }

    @Test
    @DisplayName("Folders without a type tag are kept as OTHER")
    void testUntaggedFolder() {
        Folder untagged = Folder.builder().id("u").name("Notes").type(null).build();

        FolderDirectory directory = FolderDirectory.classify(List.of(untagged));

        assertThat(directory.get(FolderType.OTHER)).containsExactly(untagged);
    }

    @Test
    @DisplayName("Listing errors propagate")
    void testListingErrorPropagates() {
        when(exchangeService.listChildFolders(account, root, Depth.SHALLOW))
                .thenThrow(new TransportException("timeout"));

        assertThatThrownBy(() -> discoverer.discover(account, root)).isInstanceOf(TransportException.class);
    }

    @Test
    @DisplayName("Account directory is discovered once from the distinguished root")
    void testAccountFoldersCached() {
        when(exchangeService.getFolderByDistinguishedId(account, FolderType.ROOT)).thenReturn(root);
        when(exchangeService.listChildFolders(account, root, Depth.SHALLOW)).thenReturn(List.of());
        when(exchangeService.listChildFolders(account, root, Depth.DEEP)).thenReturn(List.of());

        FolderDirectory first = account.getFolders();
        FolderDirectory second = account.getFolders();

        assertThat(second).isSameAs(first);
        verify(exchangeService, times(1)).listChildFolders(account, root, Depth.SHALLOW);
        verify(exchangeService, times(1)).getFolderByDistinguishedId(account, FolderType.ROOT);
    }
}
