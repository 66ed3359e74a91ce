package com.ewsaccount.controller;

import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;
import com.ewsaccount.errors.AccessDeniedException;
import com.ewsaccount.errors.AmbiguousDefaultException;
import com.ewsaccount.errors.NoUsableDefaultException;
import com.ewsaccount.errors.TransportException;
import com.ewsaccount.service.Account;
import com.ewsaccount.service.AccountRegistry;
import com.ewsaccount.service.FolderDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * FolderController unit tests
 */
@ExtendWith(MockitoExtension.class)
class FolderControllerTest {

    @Mock
    private AccountRegistry accountRegistry;

    @Mock
    private Account account;

    @InjectMocks
    private FolderController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    @DisplayName("Default folder of a type")
    void testGetDefaultFolder() throws Exception {
        Folder sent = Folder.builder().id("s1").name("Sendt post").type(FolderType.SENT_ITEMS).distinguished(true).build();
        when(accountRegistry.getAccount("user@example.com")).thenReturn(account);
        when(account.getPrimarySmtpAddress()).thenReturn("user@example.com");
        when(account.getDefaultFolder(FolderType.SENT_ITEMS)).thenReturn(sent);

        mockMvc.perform(get("/api/accounts/user@example.com/folders/default/sent-items"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.type").value("SENT_ITEMS"))
                .andExpect(jsonPath("$.folder.id").value("s1"))
                .andExpect(jsonPath("$.folder.name").value("Sendt post"))
                .andExpect(jsonPath("$.folder.distinguished").value(true));
    }

    @Test
    @DisplayName("Unknown folder type is a bad request")
    void testUnknownType() throws Exception {
        mockMvc.perform(get("/api/accounts/user@example.com/folders/default/mailbox"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));
        mockMvc.perform(get("/api/accounts/user@example.com/folders/default/other"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(accountRegistry);
    }

    @Test
    @DisplayName("Ambiguous default is a conflict listing the candidates")
    void testAmbiguous() throws Exception {
        Folder a = Folder.builder().id("a").name("Inbox").type(FolderType.INBOX).build();
        Folder b = Folder.builder().id("b").name("INBOX").type(FolderType.INBOX).build();
        when(accountRegistry.getAccount("user@example.com")).thenReturn(account);
        when(account.getDefaultFolder(FolderType.INBOX))
                .thenThrow(new AmbiguousDefaultException(FolderType.INBOX, List.of(a, b)));

        mockMvc.perform(get("/api/accounts/user@example.com/folders/default/inbox"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.candidates.length()").value(2))
                .andExpect(jsonPath("$.candidates[1].id").value("b"));
    }

    @Test
    @DisplayName("No usable default is not found, transport failure is a bad gateway")
    void testErrorMapping() throws Exception {
        when(accountRegistry.getAccount("user@example.com")).thenReturn(account);
        when(account.getDefaultFolder(FolderType.CONTACTS))
                .thenThrow(new NoUsableDefaultException("No useable default CONTACTS folders"));
        when(account.getDefaultFolder(FolderType.TASKS)).thenThrow(new TransportException("timeout"));

        mockMvc.perform(get("/api/accounts/user@example.com/folders/default/contacts"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No useable default CONTACTS folders"));
        mockMvc.perform(get("/api/accounts/user@example.com/folders/default/tasks"))
                .andExpect(status().isBadGateway());
    }

    @Test
    @DisplayName("Folder directory lists non-empty types")
    void testListFolders() throws Exception {
        FolderDirectory directory = FolderDirectory.classify(List.of(
                Folder.builder().id("i").name("Inbox").type(FolderType.INBOX).build(),
                Folder.builder().id("p").name("Projects").type(FolderType.OTHER).build()));
        when(accountRegistry.getAccount("user@example.com")).thenReturn(account);
        when(account.getPrimarySmtpAddress()).thenReturn("user@example.com");
        when(account.getFolders()).thenReturn(directory);

        mockMvc.perform(get("/api/accounts/user@example.com/folders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.folders.INBOX[0].name").value("Inbox"))
                .andExpect(jsonPath("$.folders.OTHER[0].id").value("p"))
                .andExpect(jsonPath("$.folders.CALENDAR").doesNotExist());
    }

    @Test
    @DisplayName("Evict unknown account is not found")
    void testEvict() throws Exception {
        when(accountRegistry.evict("user@example.com")).thenReturn(true);
        when(accountRegistry.evict("nobody@example.com")).thenReturn(false);

        mockMvc.perform(delete("/api/accounts/user@example.com"))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/api/accounts/nobody@example.com"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Access denied is forbidden with an error body")
    void testAccessDenied() throws Exception {
        when(accountRegistry.getAccount("user@example.com")).thenReturn(account);
        when(account.getFolders()).thenThrow(new AccessDeniedException("ErrorAccessDenied"));

        mockMvc.perform(get("/api/accounts/user@example.com/folders"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("ErrorAccessDenied"));
    }
}
