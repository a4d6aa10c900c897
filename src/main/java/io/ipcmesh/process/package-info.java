/**
 * Worker supervision package.
 *
 * <p>{@link io.ipcmesh.process.ManagedProcess} owns the lifecycle of one worker:
 * forking, request timeouts, exit handling and bounded restarts. The channel itself sits
 * behind {@link io.ipcmesh.process.WorkerLauncher}.
 */
package io.ipcmesh.process;
