package com.policysync.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates the status reported by the token fetcher, the controller and the
 * cache of one subsystem into a single coarse state.
 *
 * Precedence: any component reporting UNMANAGED wins. Otherwise an error or
 * detailed state from the token fetcher wins, then the controller, then the cache.
 * UNENROLLED without details counts as "nothing to say" and passes control on.
 * Observers are only told about actual changes.
 */
public class PolicyNotifier {

    private static final Logger log = LoggerFactory.getLogger(PolicyNotifier.class);

    public interface Observer {
        void onStateChanged(SubsystemState state, ErrorDetails details);
    }

    private final Map<NotifierSource, SubsystemState> componentStates = new EnumMap<>(NotifierSource.class);
    private final Map<NotifierSource, ErrorDetails> componentDetails = new EnumMap<>(NotifierSource.class);
    private final CopyOnWriteArrayList<Observer> observers = new CopyOnWriteArrayList<>();

    private SubsystemState state = SubsystemState.UNENROLLED;
    private ErrorDetails errorDetails = ErrorDetails.NO_DETAILS;

    public PolicyNotifier() {
        for (NotifierSource source : NotifierSource.values()) {
            componentStates.put(source, SubsystemState.UNENROLLED);
            componentDetails.put(source, ErrorDetails.NO_DETAILS);
        }
    }

    public void inform(SubsystemState state, ErrorDetails details, NotifierSource source) {
        componentStates.put(source, state);
        componentDetails.put(source, details);
        recomputeState();
    }

    public SubsystemState state() {
        return state;
    }

    public ErrorDetails errorDetails() {
        return errorDetails;
    }

    public void addObserver(Observer observer) {
        observers.add(observer);
    }

    public void removeObserver(Observer observer) {
        observers.remove(observer);
    }

    private void recomputeState() {
        SubsystemState newState;
        ErrorDetails newDetails;

        if (componentStates.containsValue(SubsystemState.UNMANAGED)) {
            newState = SubsystemState.UNMANAGED;
            newDetails = ErrorDetails.NO_DETAILS;
        } else if (isDecisive(NotifierSource.TOKEN_FETCHER, true)) {
            newState = componentStates.get(NotifierSource.TOKEN_FETCHER);
            newDetails = componentDetails.get(NotifierSource.TOKEN_FETCHER);
        } else if (isDecisive(NotifierSource.POLICY_CONTROLLER, false)) {
            newState = componentStates.get(NotifierSource.POLICY_CONTROLLER);
            newDetails = componentDetails.get(NotifierSource.POLICY_CONTROLLER);
        } else {
            newState = componentStates.get(NotifierSource.POLICY_CACHE);
            newDetails = componentDetails.get(NotifierSource.POLICY_CACHE);
        }

        if (newState == state && newDetails == errorDetails) {
            return;
        }
        state = newState;
        errorDetails = newDetails;
        log.info("Policy subsystem state changed to {} ({})", state, errorDetails);
        for (Observer observer : observers) {
            try {
                observer.onStateChanged(state, errorDetails);
            } catch (RuntimeException ex) {
                log.warn("Notifier observer failed for state={}: {}", state, ex.getMessage());
            }
        }
    }

    // The fetcher only overrides later components when it reports a problem;
    // a successfully fetched token lets the controller speak.
    private boolean isDecisive(NotifierSource source, boolean errorsOnly) {
        SubsystemState s = componentStates.get(source);
        ErrorDetails d = componentDetails.get(source);
        if (s == SubsystemState.UNENROLLED) {
            return d != ErrorDetails.NO_DETAILS;
        }
        if (errorsOnly) {
            return s == SubsystemState.NETWORK_ERROR
                || s == SubsystemState.BAD_GAIA_TOKEN
                || s == SubsystemState.LOCAL_ERROR;
        }
        return true;
    }
}
