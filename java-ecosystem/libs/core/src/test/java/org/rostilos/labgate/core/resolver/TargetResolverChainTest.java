package org.rostilos.labgate.core.resolver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.rostilos.labgate.vcsclient.gitlab.model.EMembershipScope;
import org.rostilos.labgate.vcsclient.gitlab.model.GitLabTarget;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TargetResolverChainTest {

    @Mock
    private GitLabClient gitLabClient;

    @Test
    void testGroupsFirst_Order() {
        TargetResolverChain chain = TargetResolverChain.groupsFirst(gitLabClient);

        assertThat(chain.getResolvers()).extracting(TargetResolver::scope)
                .containsExactly(EMembershipScope.GROUP, EMembershipScope.PROJECT);
    }

    @Test
    void testAmbiguousPath_ResolvesToGroup() throws Exception {
        GitLabTarget group = new GitLabTarget(EMembershipScope.GROUP, 1, "team/sub", "Sub", null);
        when(gitLabClient.findGroup("team/sub")).thenReturn(Optional.of(group));

        TargetResolution resolution = TargetResolverChain.groupsFirst(gitLabClient).resolve("team/sub");

        assertThat(resolution).isEqualTo(new TargetResolution.Resolved(group));
        verify(gitLabClient, never()).findProject(any());
    }

    @Test
    void testFallsBackToProject() throws Exception {
        GitLabTarget project = new GitLabTarget(EMembershipScope.PROJECT, 2, "team/app", "App", null);
        when(gitLabClient.findGroup("team/app")).thenReturn(Optional.empty());
        when(gitLabClient.findProject("team/app")).thenReturn(Optional.of(project));

        TargetResolution resolution = TargetResolverChain.groupsFirst(gitLabClient).resolve("team/app");

        assertThat(resolution).isInstanceOf(TargetResolution.Resolved.class);
        assertThat(((TargetResolution.Resolved) resolution).target().scope()).isEqualTo(EMembershipScope.PROJECT);
    }

    @Test
    void testNothingResolves_ReturnsUnresolved() throws Exception {
        when(gitLabClient.findGroup("ghost")).thenReturn(Optional.empty());
        when(gitLabClient.findProject("ghost")).thenReturn(Optional.empty());

        TargetResolution resolution = TargetResolverChain.groupsFirst(gitLabClient).resolve("ghost");

        assertThat(resolution).isEqualTo(new TargetResolution.Unresolved("ghost"));
    }

    @Test
    void testCustomOrder_IsHonoured() throws Exception {
        GitLabTarget project = new GitLabTarget(EMembershipScope.PROJECT, 2, "team/app", "App", null);
        when(gitLabClient.findProject("team/app")).thenReturn(Optional.of(project));
        TargetResolverChain chain = new TargetResolverChain(List.of(
                new ProjectTargetResolver(gitLabClient),
                new GroupTargetResolver(gitLabClient)));

        assertThat(chain.resolve("team/app")).isEqualTo(new TargetResolution.Resolved(project));
        verify(gitLabClient, never()).findGroup(any());
    }

    @Test
    void testEmptyChain_IsRejected() {
        assertThatThrownBy(() -> new TargetResolverChain(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
