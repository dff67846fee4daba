package me.golemcore.hrms.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hrms.adapter.outbound.security.ConfiguredRolePermissionsAdapter;
import me.golemcore.hrms.domain.exception.UpstreamServiceException;
import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.ChatReply;
import me.golemcore.hrms.domain.model.LlmRequest;
import me.golemcore.hrms.domain.model.LlmResponse;
import me.golemcore.hrms.domain.model.Message;
import me.golemcore.hrms.domain.model.ReplySource;
import me.golemcore.hrms.domain.model.UserRole;
import me.golemcore.hrms.domain.system.toolloop.DefaultToolLoopSystem;
import me.golemcore.hrms.domain.system.toolloop.DispatcherToolExecutorAdapter;
import me.golemcore.hrms.domain.tool.HrToolCatalog;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.port.outbound.AppraisalPort;
import me.golemcore.hrms.port.outbound.AttendancePort;
import me.golemcore.hrms.port.outbound.AuditPort;
import me.golemcore.hrms.port.outbound.EmployeePort;
import me.golemcore.hrms.port.outbound.HrPolicyPort;
import me.golemcore.hrms.port.outbound.LeavePort;
import me.golemcore.hrms.port.outbound.LlmPort;
import me.golemcore.hrms.port.outbound.PayrollPort;
import me.golemcore.hrms.port.outbound.UpdateRequestPort;
import me.golemcore.hrms.port.outbound.UserAccountPort;
import me.golemcore.hrms.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AgentOrchestratorTest {

    private static final CallerIdentity EMPLOYEE = CallerIdentity.builder()
            .id("asha@acme.test").name("Asha").role(UserRole.EMPLOYEE).empCode("EMP001").sessionId("s-asha")
            .build();

    @Mock
    private LlmPort llmPort;
    @Mock
    private EmployeePort employeePort;
    @Mock
    private LeavePort leavePort;
    @Mock
    private AttendancePort attendancePort;
    @Mock
    private PayrollPort payrollPort;
    @Mock
    private HrPolicyPort hrPolicyPort;
    @Mock
    private UpdateRequestPort updateRequestPort;
    @Mock
    private AppraisalPort appraisalPort;
    @Mock
    private UserAccountPort userAccountPort;
    @Mock
    private AuditPort auditPort;

    private MutableClock clock;
    private HrmsProperties properties;
    private QueryCache queryCache;
    private ConversationSessionService sessionService;
    private DefaultToolLoopSystem toolLoop;
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock(Instant.parse("2025-03-15T10:00:00Z"));
        properties = new HrmsProperties();

        HrToolHandlers handlers = new HrToolHandlers(employeePort, leavePort, attendancePort, payrollPort,
                hrPolicyPort, updateRequestPort, appraisalPort, userAccountPort, clock);
        PermissionGate gate = new PermissionGate(new ConfiguredRolePermissionsAdapter(properties));
        HrToolDispatcher dispatcher = new HrToolDispatcher(gate, handlers, auditPort, Runnable::run, properties,
                clock);
        ObjectMapper objectMapper = new ObjectMapper();
        HrToolCatalog catalog = new HrToolCatalog(objectMapper);
        catalog.init();
        toolLoop = new DefaultToolLoopSystem(llmPort,
                new DispatcherToolExecutorAdapter(dispatcher, objectMapper), catalog, properties, clock);

        queryCache = spy(new QueryCache(properties, clock));
        sessionService = new ConversationSessionService(properties, clock);
        orchestrator = new AgentOrchestrator(new FaqMatcher(), queryCache, sessionService,
                new SessionTurnCoordinator(Runnable::run), new SystemPromptService(), toolLoop, clock);
    }

    private ChatReply turn(String message) {
        return orchestrator.submit(EMPLOYEE, message).join();
    }

    private static CompletableFuture<LlmResponse> finalAnswer(String text) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(text).build());
    }

    private static CompletableFuture<LlmResponse> toolCall(String id, String name, Map<String, Object> args) {
        Message.ToolCall call = Message.ToolCall.builder().id(id).name(name).arguments(args).build();
        return CompletableFuture.completedFuture(LlmResponse.builder().toolCalls(List.of(call)).build());
    }

    // ==================== Short circuits ====================

    @Test
    void shouldAnswerHolidayQuestionFromFaqWithoutCaching() {
        ChatReply reply = turn("what are the public holidays");

        assertEquals(ReplySource.FAQ, reply.source());
        assertTrue(reply.reply().contains("Republic Day"));
        assertEquals(0, queryCache.size());
        assertTrue(sessionService.find("s-asha").isEmpty());
        verifyNoInteractions(llmPort);
    }

    @Test
    void shouldServeRepeatedQuestionFromCacheWithOneCompletionCall() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("Your March payroll: net 84,000."));

        ChatReply first = turn("show my payroll");
        clock.advance(Duration.ofMinutes(2));
        ChatReply second = turn("  Show my payroll?  ");

        assertEquals(ReplySource.MODEL, first.source());
        assertEquals(ReplySource.CACHE, second.source());
        assertEquals(first.reply(), second.reply());
        verify(llmPort, times(1)).chat(any());
        assertEquals(2, sessionService.history("s-asha").size());
    }

    @Test
    void shouldAskModelAgainAfterCacheEntryExpires() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("first"), finalAnswer("second"));

        turn("show my payroll");
        clock.advance(properties.getCache().getTtl().plusSeconds(1));
        ChatReply reply = turn("show my payroll");

        assertEquals("second", reply.reply());
        assertEquals(ReplySource.MODEL, reply.source());
    }

    // ==================== Tool rounds ====================

    @Test
    void shouldFeedDenialBackToModelAndFinishTurn() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("call-1", "list_all_employees", Map.of()),
                finalAnswer("You can only view your own records."));

        ChatReply reply = turn("list every employee");

        assertEquals(ReplySource.MODEL, reply.source());
        assertEquals("You can only view your own records.", reply.reply());
        verifyNoInteractions(employeePort, auditPort);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        List<Message> secondRound = captor.getAllValues().get(1).getMessages();
        Message toolMessage = secondRound.get(secondRound.size() - 1);
        assertEquals("call-1", toolMessage.getToolCallId());
        assertTrue(toolMessage.getContent().contains("does not have 'view_all_data' permission"));
        assertTrue(queryCache.get("list every employee").isPresent());
    }

    @Test
    void shouldInvalidateCacheOnceAfterWrite() {
        queryCache.set("how many leaves do i have left", "You have 5 casual leaves.");
        when(leavePort.applyLeave("EMP001", "casual", "2025-03-20", "2025-03-20", "personal"))
                .thenReturn(Map.of("message", "Leave applied."));
        when(llmPort.chat(any())).thenReturn(
                toolCall("call-1", "apply_leave", Map.of("emp_code", "EMP001", "leave_type", "casual",
                        "start_date", "2025-03-20", "end_date", "2025-03-20", "reason", "personal")),
                finalAnswer("Your leave is applied."));

        ChatReply reply = turn("apply casual leave on 20 march");

        assertTrue(reply.wroteData());
        verify(queryCache, times(1)).invalidateAll();
        assertEquals(0, queryCache.size());
        assertTrue(queryCache.get("apply casual leave on 20 march").isEmpty());
        verify(auditPort).record(any());
    }

    @Test
    void shouldCacheFallbackWhenRoundsRunOut() {
        properties.getAgent().setMaxToolRounds(4);
        when(llmPort.chat(any())).thenReturn(toolCall("call-x", "get_company_stats", Map.of()));
        when(employeePort.getCompanyStats()).thenReturn(Map.of("total_employees", 42));

        ChatReply first = turn("keep checking stats");
        ChatReply second = turn("keep checking stats");

        assertEquals(ReplySource.FALLBACK, first.source());
        assertEquals(properties.getAgent().getFallbackMessage(), first.reply());
        assertEquals(ReplySource.CACHE, second.source());
        assertEquals(first.reply(), second.reply());
        verify(llmPort, times(4)).chat(any());
        verify(queryCache, never()).invalidateAll();
    }

    @Test
    void shouldRecordToolNamesOnCachedReply() {
        when(payrollPort.getSlips("EMP001", null)).thenReturn(List.of(Map.of("month", "2025-02")));
        when(llmPort.chat(any())).thenReturn(
                toolCall("call-1", "get_payroll", Map.of("emp_code", "EMP001")),
                finalAnswer("February payroll found."));

        turn("show my payroll");

        assertEquals("get_payroll", queryCache.get("show my payroll").orElseThrow().getToolUsed());
    }

    // ==================== Failures and queuing ====================

    @Test
    void shouldPropagateUpstreamFailureWithoutCachingOrReply() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        CompletionException error = assertThrows(CompletionException.class, () -> turn("show my payroll"));
        assertTrue(error.getCause() instanceof UpstreamServiceException);

        assertEquals(0, queryCache.size());
        List<Message> history = sessionService.history("s-asha");
        assertEquals(1, history.size());
        assertTrue(history.get(0).isUserMessage());
    }

    @Test
    void shouldNotServeCachedReplyAheadOfQueuedWriteInSameSession() throws Exception {
        queryCache.set("show my leave records", "You have 12 casual leaves.");
        CompletableFuture<LlmResponse> pendingWrite = new CompletableFuture<>();
        when(leavePort.applyLeave("EMP001", "casual", "2025-03-20", "2025-03-20", "personal"))
                .thenReturn(Map.of("message", "Leave applied."));
        when(llmPort.chat(any())).thenReturn(
                pendingWrite,
                finalAnswer("Your leave is applied."),
                finalAnswer("You have 11 casual leaves."));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            AgentOrchestrator queued = new AgentOrchestrator(new FaqMatcher(), queryCache, sessionService,
                    new SessionTurnCoordinator(executor), new SystemPromptService(), toolLoop, clock);

            CompletableFuture<ChatReply> write = queued.submit(EMPLOYEE, "apply casual leave on 20 march");
            CompletableFuture<ChatReply> read = queued.submit(EMPLOYEE, "show my leave records");

            Thread.sleep(50);
            assertFalse(read.isDone());

            pendingWrite.complete(toolCall("call-1", "apply_leave", Map.of("emp_code", "EMP001",
                    "leave_type", "casual", "start_date", "2025-03-20", "end_date", "2025-03-20",
                    "reason", "personal")).join());

            assertTrue(write.get(2, TimeUnit.SECONDS).wroteData());
            ChatReply reply = read.get(2, TimeUnit.SECONDS);
            assertEquals(ReplySource.MODEL, reply.source());
            assertEquals("You have 11 casual leaves.", reply.reply());
            verify(llmPort, times(3)).chat(any());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldCompleteSubmittedTurn() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("Hello Asha"));

        ChatReply reply = orchestrator.submit(EMPLOYEE, "hello there").join();

        assertEquals("Hello Asha", reply.reply());
        assertEquals(1, reply.llmCalls());
    }

    @Test
    void shouldIncludeCallerInSystemPrompt() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("ok"));

        turn("hello there");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        Message system = captor.getValue().getMessages().get(0);
        assertTrue(system.isSystemMessage());
        assertTrue(system.getContent().contains("EMP001"));
        assertTrue(system.getContent().contains("Role: employee"));
    }
}
