package infosquito.supervisor;

/**
 * Lifecycle states of a {@link SubscriptionSupervisor}.
 *
 * <p>While running, the supervisor cycles
 * {@code DISCONNECTED -> CONNECTING -> SUBSCRIBED -> TEARING_DOWN -> DISCONNECTED}.
 * {@link #STOPPED} is only reached after {@link SubscriptionSupervisor#close()}.
 */
public enum SupervisorState {
  DISCONNECTED,
  CONNECTING,
  SUBSCRIBED,
  TEARING_DOWN,
  STOPPED
}
