package com.policysync.identity;

import com.policysync.contract.PolicyType;
import com.policysync.contract.UserAffiliation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Credentials and identifiers of one policy domain: the device management
 * token, the user's auth token, the client id and machine details.
 *
 * Empty strings stand for "not known". Like the rest of the subsystem this
 * class is used from the policy sequence only.
 */
public class IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(IdentityStore.class);

    public interface Observer {
        /** The device management token was set or cleared. */
        void onDeviceTokenChanged();

        /** The user name, the auth token or the token cache state changed. */
        void onCredentialsChanged();
    }

    private final PolicyType policyType;
    private final CopyOnWriteArrayList<Observer> observers = new CopyOnWriteArrayList<>();

    private String deviceToken = "";
    private String deviceId = "";
    private String userName = "";
    private String authToken = "";
    private String machineId = "";
    private String machineModel = "";
    private boolean tokenCacheLoaded;
    private UserAffiliation userAffiliation = UserAffiliation.NONE;

    public IdentityStore(PolicyType policyType) {
        this.policyType = policyType;
    }

    public static IdentityStore forUserPolicies() {
        return new IdentityStore(PolicyType.USER);
    }

    public static IdentityStore forDevicePolicies() {
        return new IdentityStore(PolicyType.DEVICE);
    }

    public PolicyType policyType() {
        return policyType;
    }

    public String deviceToken() {
        return deviceToken;
    }

    public String deviceId() {
        return deviceId;
    }

    public String userName() {
        return userName;
    }

    public boolean hasAuthToken() {
        return !authToken.isEmpty();
    }

    public String authToken() {
        return authToken;
    }

    public boolean tokenCacheLoaded() {
        return tokenCacheLoaded;
    }

    public UserAffiliation userAffiliation() {
        return userAffiliation;
    }

    public String machineId() {
        return machineId;
    }

    public String machineModel() {
        return machineModel;
    }

    public void setDeviceToken(String deviceToken) {
        String normalized = nullToEmpty(deviceToken);
        if (normalized.equals(this.deviceToken)) {
            return;
        }
        this.deviceToken = normalized;
        log.info("Device token for {} policy {}", policyType.getDomain(),
            normalized.isEmpty() ? "cleared" : "updated");
        for (Observer observer : observers) {
            try {
                observer.onDeviceTokenChanged();
            } catch (RuntimeException ex) {
                log.warn("Identity observer failed on device token change for {}: {}",
                    policyType.getDomain(), ex.getMessage());
            }
        }
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = nullToEmpty(deviceId);
    }

    public void setUserNameAndAuthToken(String userName, String authToken) {
        this.userName = nullToEmpty(userName);
        this.authToken = nullToEmpty(authToken);
        notifyCredentialsChanged();
    }

    public void setTokenCacheLoaded() {
        if (tokenCacheLoaded) {
            return;
        }
        tokenCacheLoaded = true;
        notifyCredentialsChanged();
    }

    public void setUserAffiliation(UserAffiliation userAffiliation) {
        this.userAffiliation = userAffiliation != null ? userAffiliation : UserAffiliation.NONE;
    }

    public void setMachineIdAndModel(String machineId, String machineModel) {
        this.machineId = nullToEmpty(machineId);
        this.machineModel = nullToEmpty(machineModel);
    }

    public void addObserver(Observer observer) {
        observers.add(observer);
    }

    public void removeObserver(Observer observer) {
        observers.remove(observer);
    }

    private void notifyCredentialsChanged() {
        for (Observer observer : observers) {
            try {
                observer.onCredentialsChanged();
            } catch (RuntimeException ex) {
                log.warn("Identity observer failed on credentials change for {}: {}",
                    policyType.getDomain(), ex.getMessage());
            }
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
