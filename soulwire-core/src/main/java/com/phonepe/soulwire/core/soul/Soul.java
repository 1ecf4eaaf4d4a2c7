package com.phonepe.soulwire.core.soul;

import com.phonepe.soulwire.core.approval.Approval;
import com.phonepe.soulwire.core.compaction.AutoCompaction;
import com.phonepe.soulwire.core.compaction.Compaction;
import com.phonepe.soulwire.core.compaction.SimpleCompaction;
import com.phonepe.soulwire.core.context.Context;
import com.phonepe.soulwire.core.context.InMemoryContext;
import com.phonepe.soulwire.core.errors.ApprovalException;
import com.phonepe.soulwire.core.errors.MaxStepsReachedException;
import com.phonepe.soulwire.core.errors.NoActiveTurnException;
import com.phonepe.soulwire.core.errors.RunCancelledException;
import com.phonepe.soulwire.core.errors.TurnInProgressException;
import com.phonepe.soulwire.core.messages.ContentPart;
import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.messages.Role;
import com.phonepe.soulwire.core.messages.StreamedMessagePart;
import com.phonepe.soulwire.core.messages.TextPart;
import com.phonepe.soulwire.core.messages.ToolCall;
import com.phonepe.soulwire.core.messages.ToolCallPart;
import com.phonepe.soulwire.core.provider.ChatProvider;
import com.phonepe.soulwire.core.provider.GenerateResult;
import com.phonepe.soulwire.core.provider.Generator;
import com.phonepe.soulwire.core.retry.ProviderCallRetrier;
import com.phonepe.soulwire.core.tools.ToolCallContext;
import com.phonepe.soulwire.core.tools.ToolDispatcher;
import com.phonepe.soulwire.core.tools.ToolResults;
import com.phonepe.soulwire.core.tools.Toolset;
import com.phonepe.soulwire.core.utils.SoulUtils;
import com.phonepe.soulwire.core.wire.Wire;
import com.phonepe.soulwire.core.wire.messages.ApprovalResponse;
import com.phonepe.soulwire.core.wire.messages.CompactionBegin;
import com.phonepe.soulwire.core.wire.messages.CompactionEnd;
import com.phonepe.soulwire.core.wire.messages.ContentPartEvent;
import com.phonepe.soulwire.core.wire.messages.StatusUpdate;
import com.phonepe.soulwire.core.wire.messages.StepBegin;
import com.phonepe.soulwire.core.wire.messages.StepInterrupted;
import com.phonepe.soulwire.core.wire.messages.ToolCallEvent;
import com.phonepe.soulwire.core.wire.messages.ToolCallPartEvent;
import com.phonepe.soulwire.core.wire.messages.ToolResult;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import com.phonepe.soulwire.core.wire.messages.TurnBegin;
import com.phonepe.soulwire.core.wire.messages.TurnEnd;
import com.phonepe.soulwire.core.wire.messages.UserInput;
import com.phonepe.soulwire.core.wire.messages.WireRequest;
import io.appform.signals.signals.ConsumingFireForgetSignal;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The turn engine. A turn takes one user input and runs steps until the model stops calling tools. Each step is
 * one model call followed by the execution of the tool calls it asked for. Everything that happens is published
 * on the {@link Wire}.
 * <p>
 * Only one turn runs at a time. {@link #run(UserInput)} blocks the calling thread for the whole turn,
 * {@link #cancel()} and {@link #steer(UserInput)} are meant to be called from other threads.
 */
@Slf4j
public class Soul {
    private final String name;
    private final String systemPrompt;
    private final ChatProvider provider;
    private final Toolset toolset;
    private final Context context;
    private final Approval approval;
    private final Wire wire;
    private final SoulSetup setup;
    private final Compaction compaction;
    private final SlashCommands slashCommands;
    private final ProviderCallRetrier retrier;
    private final ToolDispatcher toolDispatcher;

    private final AtomicReference<SoulState> state = new AtomicReference<>(SoulState.IDLE);
    private final ConsumingFireForgetSignal<TurnOutcome> turnCompleted;
    private volatile ActiveTurn activeTurn;

    private static final class ActiveTurn {
        private final CompletableFuture<Void> cancelled = new CompletableFuture<>();
        private final Queue<UserInput> steers = new ConcurrentLinkedQueue<>();
        private boolean closed;

        boolean isCancelled() {
            return cancelled.isDone();
        }

        synchronized void addSteer(UserInput input) {
            if (closed) {
                throw new NoActiveTurnException();
            }
            steers.add(input);
        }

        /**
         * Closes the turn for steering unless steer input is still waiting
         *
         * @return true if the turn was closed
         */
        synchronized boolean closeIfNotSteered() {
            if (!steers.isEmpty()) {
                return false;
            }
            closed = true;
            return true;
        }

        /**
         * @return Steer input that arrived but was never sent to the model
         */
        synchronized List<UserInput> close() {
            closed = true;
            final var pending = new ArrayList<>(steers);
            steers.clear();
            return pending;
        }
    }

    private record StepResult(StopReason stopReason, Message assistantMessage) {
        boolean finished() {
            return null != stopReason;
        }
    }

    @Builder
    public Soul(
            String name,
            String systemPrompt,
            @NonNull ChatProvider provider,
            Toolset toolset,
            Context context,
            Approval approval,
            @NonNull Wire wire,
            SoulSetup setup,
            Compaction compaction,
            SlashCommands slashCommands) {
        this.name = Objects.requireNonNullElse(name, "main");
        this.systemPrompt = Objects.requireNonNullElse(systemPrompt, "");
        this.provider = provider;
        this.toolset = Objects.requireNonNullElseGet(toolset, Toolset::new);
        this.context = Objects.requireNonNullElseGet(context, InMemoryContext::new);
        this.approval = Objects.requireNonNullElseGet(approval, Approval::new);
        this.wire = wire;
        this.setup = Objects.requireNonNullElseGet(setup, () -> SoulSetup.builder().build());
        this.compaction = Objects.requireNonNullElseGet(
                compaction, () -> new SimpleCompaction(this.setup.getCompaction().getMaxPreservedMessages()));
        this.slashCommands = Objects.requireNonNullElseGet(slashCommands, SlashCommands::withBuiltins);
        this.retrier = new ProviderCallRetrier(this.setup.getMaxRetriesPerStep(), this.setup.getRetrySetup());
        this.toolDispatcher = new ToolDispatcher(this.toolset, this.setup.getExecutorService());
        this.turnCompleted = ConsumingFireForgetSignal.<TurnOutcome>builder()
                .executorService(this.setup.getExecutorService())
                .build();
    }

    public String name() {
        return name;
    }

    public String modelName() {
        return provider.modelName();
    }

    public Context context() {
        return context;
    }

    public Approval approval() {
        return approval;
    }

    public Wire wire() {
        return wire;
    }

    public SoulState state() {
        return state.get();
    }

    public SlashCommands slashCommands() {
        return slashCommands;
    }

    /**
     * @return Signal raised after every turn that ended normally. Use connect() to add handlers.
     */
    public ConsumingFireForgetSignal<TurnOutcome> onTurnCompleted() {
        return turnCompleted;
    }

    /**
     * Run a turn for the given input. Blocks until the turn is over.
     *
     * @throws TurnInProgressException  if a turn is already running
     * @throws MaxStepsReachedException if the model keeps calling tools for too many steps
     * @throws RunCancelledException    if {@link #cancel()} was called
     * @throws com.phonepe.soulwire.core.errors.ChatProviderException if the provider keeps failing
     */
    public TurnOutcome run(UserInput userInput) throws InterruptedException {
        if (!state.compareAndSet(SoulState.IDLE, SoulState.TURN_ACTIVE)) {
            throw new TurnInProgressException();
        }
        final var turn = new ActiveTurn();
        activeTurn = turn;
        try {
            log.info("Agent {} starting turn", name);
            wire.publish(new TurnBegin(userInput));
            final var command = userInput.isText()
                                ? SlashCommands.parse(userInput.getText())
                                : Optional.<SlashCommands.Invocation>empty();
            final TurnOutcome outcome;
            if (command.isPresent()) {
                slashCommands.run(this, command.get());
                outcome = new TurnOutcome(StopReason.SLASH_COMMAND, null, 0);
            }
            else {
                context.checkpoint();
                context.append(Message.of(Role.USER, userInput.toContent()));
                outcome = agentLoop(turn);
            }
            wire.publish(new TurnEnd());
            log.info("Agent {} finished turn. Stop reason: {} Steps: {}",
                     name, outcome.getStopReason(), outcome.getStepCount());
            turnCompleted.dispatch(outcome);
            return outcome;
        }
        finally {
            final var unsent = turn.close();
            activeTurn = null;
            state.set(SoulState.IDLE);
            if (!unsent.isEmpty()) {
                log.info("Agent {} keeping {} steer inputs that arrived after the last model call", name, unsent.size());
                context.append(unsent.stream()
                                       .map(input -> Message.of(Role.USER, input.toContent()))
                                       .toList());
            }
        }
    }

    /**
     * Interrupts the running turn. Pending tool calls are finalized as interrupted and outstanding requests get
     * their default answers.
     *
     * @throws NoActiveTurnException if no turn is running
     */
    public void cancel() {
        final var turn = activeTurn;
        if (null == turn) {
            throw new NoActiveTurnException();
        }
        log.info("Cancelling turn of agent {}", name);
        turn.cancelled.complete(null);
        wire.outstandingRequests().forEach(WireRequest::resolveWithDefault);
        approval.rejectAll();
    }

    /**
     * Adds input to the running turn. It is sent to the model before the next model call, and forces one if the
     * model was about to finish. Input accepted while a turn ends abnormally is kept in the context.
     *
     * @throws NoActiveTurnException if no turn is running or the running turn has already finished its last step
     */
    public void steer(UserInput input) {
        final var turn = activeTurn;
        if (null == turn) {
            throw new NoActiveTurnException();
        }
        turn.addSteer(input);
        log.debug("Agent {} received steer input", name);
    }

    void publishNotice(String text) {
        wire.publish(new ContentPartEvent(new TextPart(text)));
    }

    void compactContext(String customInstruction) throws InterruptedException {
        wire.publish(new CompactionBegin());
        final var history = context.history();
        log.info("Compacting context of agent {}. Messages: {} Tokens: {}", name, history.size(), context.tokenCount());
        final var task = CompletableFuture.supplyAsync(
                () -> retrier.call(provider, () -> compaction.compact(history, provider, customInstruction)),
                setup.getExecutorService());
        final var result = awaitOrCancel(task, activeTurn);
        context.replace(result.getMessages());
        context.updateTokenCount(result.estimatedTokenCount());
        wire.publish(new CompactionEnd());
        log.info("Context of agent {} compacted. Messages: {} Estimated tokens: {}",
                 name, result.getMessages().size(), result.estimatedTokenCount());
    }

    private TurnOutcome agentLoop(ActiveTurn turn) throws InterruptedException {
        var stepNo = 0;
        while (true) {
            stepNo++;
            if (stepNo > setup.getMaxStepsPerTurn()) {
                throw new MaxStepsReachedException(setup.getMaxStepsPerTurn());
            }
            state.set(SoulState.STEP_ACTIVE);
            wire.publish(new StepBegin(stepNo));
            final var approvalPipe = setup.getExecutorService().submit(this::pipeApprovals);
            final StepResult result;
            try {
                if (stepNo == 1 && shouldAutoCompact()) {
                    compactContext(null);
                }
                context.checkpoint();
                result = step(turn);
                if (shouldAutoCompact()) {
                    compactContext(null);
                }
            }
            catch (RuntimeException | InterruptedException e) {
                log.info("Step {} of agent {} interrupted: {}", stepNo, name, e.getMessage());
                wire.publish(new StepInterrupted());
                throw e;
            }
            finally {
                stopApprovalPipe(approvalPipe);
                state.set(SoulState.TURN_ACTIVE);
            }
            if (result.finished()) {
                final var finalMessage = result.stopReason() == StopReason.NO_TOOL_CALLS
                                         ? result.assistantMessage()
                                         : null;
                return new TurnOutcome(result.stopReason(), finalMessage, stepNo);
            }
        }
    }

    private StepResult step(ActiveTurn turn) throws InterruptedException {
        drainSteers(turn);
        final var history = context.history();
        final var tools = toolset.definitions();
        final var generation = CompletableFuture.supplyAsync(
                () -> retrier.call(provider, () -> Generator.generate(provider,
                                                                      systemPrompt,
                                                                      tools,
                                                                      history,
                                                                      part -> publishPart(turn, part))),
                setup.getExecutorService());
        final GenerateResult generated = awaitOrCancel(generation, turn);
        final var message = generated.getMessage();
        log.debug("Got step result: id={}, tool_calls={}", generated.getId(), message.toolCallsOrEmpty().size());

        final var usage = generated.getUsage();
        if (null != usage) {
            context.updateTokenCount(usage.input());
        }
        wire.publish(StatusUpdate.builder()
                             .contextUsage(null != usage ? contextUsage() : null)
                             .tokenUsage(usage)
                             .messageId(generated.getId())
                             .build());

        final var toolResults = runTools(turn, message);
        growContext(message, toolResults);

        if (toolResults.stream().anyMatch(result -> ToolResults.isRejection(result.getReturnValue()))) {
            return new StepResult(StopReason.TOOL_REJECTED, message);
        }
        if (message.hasToolCalls() || !turn.closeIfNotSteered()) {
            return new StepResult(null, message);
        }
        return new StepResult(StopReason.NO_TOOL_CALLS, message);
    }

    private List<ToolResult> runTools(ActiveTurn turn, Message message) throws InterruptedException {
        final var toolCalls = message.toolCallsOrEmpty();
        if (toolCalls.isEmpty()) {
            return List.of();
        }
        final var slots = new ArrayList<CompletableFuture<ToolReturnValue>>();
        final var published = new ArrayList<CompletableFuture<Void>>();
        for (final var toolCall : toolCalls) {
            //Whoever completes the slot first (the tool or a cancellation) decides the result
            final var slot = new CompletableFuture<ToolReturnValue>();
            published.add(slot.thenAccept(result -> wire.publish(new ToolResult(toolCall.getId(), result))));
            toolDispatcher.dispatch(new ToolCallContext(toolCall, approval, wire, setup.getMapper()))
                    .whenComplete((result, error) -> slot.complete(
                            null == error
                            ? result
                            : ToolReturnValue.error("",
                                                    SoulUtils.rootCause(error).getMessage(),
                                                    "Tool error")));
            slots.add(slot);
        }
        try {
            awaitOrCancel(CompletableFuture.allOf(published.toArray(CompletableFuture[]::new)), turn);
        }
        catch (RunCancelledException e) {
            slots.forEach(slot -> slot.complete(ToolReturnValue.interrupted()));
            CompletableFuture.allOf(published.toArray(CompletableFuture[]::new)).join();
            growContext(message, collectResults(toolCalls, slots));
            throw e;
        }
        return collectResults(toolCalls, slots);
    }

    private static List<ToolResult> collectResults(List<ToolCall> toolCalls,
                                                   List<CompletableFuture<ToolReturnValue>> slots) {
        final var results = new ArrayList<ToolResult>();
        for (var i = 0; i < toolCalls.size(); i++) {
            results.add(new ToolResult(toolCalls.get(i).getId(), slots.get(i).join()));
        }
        return results;
    }

    private void growContext(Message assistantMessage, List<ToolResult> toolResults) {
        final var messages = new ArrayList<Message>();
        messages.add(assistantMessage);
        toolResults.forEach(result -> messages.add(ToolResults.toMessage(result.getToolCallId(),
                                                                         result.getReturnValue())));
        context.append(messages);
    }

    private void drainSteers(ActiveTurn turn) {
        UserInput steer;
        while (null != (steer = turn.steers.poll())) {
            context.append(Message.of(Role.USER, steer.toContent()));
        }
    }

    private void publishPart(ActiveTurn turn, StreamedMessagePart part) {
        if (turn.isCancelled()) {
            return;
        }
        if (part instanceof ContentPart contentPart) {
            wire.publish(new ContentPartEvent(contentPart));
        }
        else if (part instanceof ToolCall toolCall) {
            wire.publish(new ToolCallEvent(toolCall));
        }
        else if (part instanceof ToolCallPart toolCallPart) {
            wire.publish(new ToolCallPartEvent(toolCallPart));
        }
    }

    private boolean shouldAutoCompact() {
        return AutoCompaction.shouldAutoCompact(context.tokenCount(),
                                                setup.getMaxContextSize(),
                                                setup.getCompaction().getTriggerRatio(),
                                                setup.getReservedContextSize());
    }

    private double contextUsage() {
        return (double) context.tokenCount() / setup.getMaxContextSize();
    }

    /**
     * Waits for the future unless the turn gets cancelled first
     */
    private static <T> T awaitOrCancel(CompletableFuture<T> future, ActiveTurn turn) throws InterruptedException {
        try {
            CompletableFuture.anyOf(future, turn.cancelled).get();
        }
        catch (ExecutionException e) {
            log.debug("Awaited task failed: {}", e.getMessage());
        }
        if (turn.isCancelled()) {
            throw new RunCancelledException();
        }
        try {
            return future.get();
        }
        catch (ExecutionException e) {
            throw SoulUtils.propagate(e);
        }
    }

    private void pipeApprovals() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                final var request = approval.fetchRequest();
                wire.request(request);
                final var outcome = request.await();
                try {
                    approval.resolveRequest(request.getId(), outcome);
                }
                catch (ApprovalException e) {
                    log.debug("Approval request {} was already settled", request.getId());
                }
                wire.publish(new ApprovalResponse(request.getId(), outcome));
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        catch (ApprovalException e) {
            log.debug("Approval pipe of agent {} stopped: {}", name, e.getMessage());
        }
    }

    private static void stopApprovalPipe(Future<?> approvalPipe) {
        approvalPipe.cancel(true);
    }
}
