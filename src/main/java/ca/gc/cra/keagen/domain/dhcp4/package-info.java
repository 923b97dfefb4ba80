/**
 * DHCPv4 service model: interfaces, lease database, subnets with pools, and option data.
 * <p><strong>Ordering:</strong> Options render by name, pools by range text, subnets by registry id.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.keagen.domain.dhcp4.Dhcp4Config} and its parts are not
 * thread-safe; callers own each instance exclusively.</p>
 */
package ca.gc.cra.keagen.domain.dhcp4;
